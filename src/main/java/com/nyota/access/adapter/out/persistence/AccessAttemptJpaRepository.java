package com.nyota.access.adapter.out.persistence;

import com.nyota.access.domain.AccessAttempt;
import com.nyota.access.domain.AccessOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface AccessAttemptJpaRepository extends JpaRepository<AccessAttempt, Long> {

    @Query("SELECT a.attemptedAt FROM AccessAttempt a " +
            "WHERE a.phoneNumber = :phoneNumber AND a.originAddress = :originAddress " +
            "AND a.attemptedAt > :since AND a.outcome IN :outcomes " +
            "ORDER BY a.attemptedAt ASC")
    List<LocalDateTime> findAttemptTimes(
            @Param("phoneNumber") String phoneNumber,
            @Param("originAddress") String originAddress,
            @Param("since") LocalDateTime since,
            @Param("outcomes") Collection<AccessOutcome> outcomes
    );
}
