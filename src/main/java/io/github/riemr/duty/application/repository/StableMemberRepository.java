package io.github.riemr.duty.application.repository;

import io.github.riemr.duty.domain.model.StableMember;

import java.util.List;
import java.util.Optional;

public interface StableMemberRepository {
    List<StableMember> findActiveByStable(String stableId);

    void save(StableMember member);

    /** 厩舎のオーナー。メンバー行が無くても順番の対象になる */
    Optional<StableMember> findOwner(String stableId);

    void saveOwner(StableMember owner);
}
