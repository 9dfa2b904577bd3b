package com.aera.backend.modules.household.infrastructure.persistence;

import java.time.OffsetDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.aera.backend.modules.household.domain.ShareCode;

public interface ShareCodeRepository extends JpaRepository<ShareCode, String> {

    /**
     * @return 1 when the code was reserved, 0 when it is already taken
     */
    @Modifying
    @Query(value = """
            insert into share_code (code, kind, created_at)
            values (:code, :kind, :createdAt)
            on conflict (code) do nothing
            """, nativeQuery = true)
    int reserve(@Param("code") String code, @Param("kind") String kind, @Param("createdAt") OffsetDateTime createdAt);

    @Modifying
    @Query("delete from ShareCode s where s.code = :code")
    int release(@Param("code") String code);
}
