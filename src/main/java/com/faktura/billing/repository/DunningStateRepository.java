package com.faktura.billing.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.faktura.billing.domain.DunningState;
import com.faktura.billing.domain.Invoice;

/** Repository for the per-invoice dunning state. */
@Repository
public interface DunningStateRepository extends JpaRepository<DunningState, Long> {

  Optional<DunningState> findByInvoice(Invoice invoice);

  @Query("SELECT d FROM DunningState d WHERE d.invoice.id = :invoiceId")
  Optional<DunningState> findByInvoiceId(@Param("invoiceId") Long invoiceId);
}
