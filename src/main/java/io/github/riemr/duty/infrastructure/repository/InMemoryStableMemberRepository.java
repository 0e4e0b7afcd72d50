package io.github.riemr.duty.infrastructure.repository;

import io.github.riemr.duty.application.repository.StableMemberRepository;
import io.github.riemr.duty.domain.model.StableMember;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryStableMemberRepository implements StableMemberRepository {

    // stableId -> (memberId -> member)
    private final Map<String, Map<String, StableMember>> store = new ConcurrentHashMap<>();
    // stableId -> owner
    private final Map<String, StableMember> owners = new ConcurrentHashMap<>();

    @Override
    public List<StableMember> findActiveByStable(String stableId) {
        if (stableId == null) return List.of();
        return store.getOrDefault(stableId, Map.of()).values().stream()
                .filter(StableMember::isActive)
                .toList();
    }

    @Override
    public void save(StableMember member) {
        store.computeIfAbsent(member.getStableId(), k -> new ConcurrentHashMap<>())
                .put(member.getMemberId(), member);
    }

    @Override
    public Optional<StableMember> findOwner(String stableId) {
        if (stableId == null) return Optional.empty();
        return Optional.ofNullable(owners.get(stableId));
    }

    @Override
    public void saveOwner(StableMember owner) {
        owners.put(owner.getStableId(), owner);
    }
}
