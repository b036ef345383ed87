package com.faktura.billing.repository;

import com.faktura.billing.domain.DunningRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DunningRunRepository extends JpaRepository<DunningRun, Long> {

    Optional<DunningRun> findTopByOrderByStartedAtDesc();

    List<DunningRun> findTop20ByOrderByStartedAtDesc();
}
