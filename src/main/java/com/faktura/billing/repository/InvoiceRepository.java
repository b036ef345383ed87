package com.faktura.billing.repository;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    Optional<Invoice> findByInvoiceNumber(String invoiceNumber);

    boolean existsByInvoiceNumber(String invoiceNumber);

    /**
     * Loads an invoice with a row lock so that read-modify-write on its money is serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invoice i WHERE i.id = :id")
    Optional<Invoice> findByIdForUpdate(@Param("id") Long id);

    // Reversal documents (cancellations, credit notes) pointing at an original
    List<Invoice> findByRelatedInvoiceOrderByIssueDateAscIdAsc(Invoice relatedInvoice);

    boolean existsByRelatedInvoiceAndType(Invoice relatedInvoice, InvoiceType type);

    @Query("SELECT COUNT(c) > 0 FROM Invoice c WHERE c.relatedInvoice.id = :invoiceId " +
           "AND c.type = :type")
    boolean existsReversalOfType(@Param("invoiceId") Long invoiceId, @Param("type") InvoiceType type);

    List<Invoice> findByProjectIdOrderByIssueDateAscIdAsc(String projectId);

    // Invoices past due with a balance, excluding reversal documents and cancelled originals
    @Query("SELECT i.id FROM Invoice i WHERE i.type NOT IN :excludedTypes " +
           "AND i.dueDate < :today AND i.paidAmount < i.amount " +
           "AND NOT EXISTS (SELECT c.id FROM Invoice c WHERE c.relatedInvoice = i AND c.type = :cancellation) " +
           "ORDER BY i.dueDate ASC, i.id ASC")
    List<Long> findDunningCandidateIds(@Param("today") LocalDate today,
                                       @Param("excludedTypes") Collection<InvoiceType> excludedTypes,
                                       @Param("cancellation") InvoiceType cancellation);

    @Query("SELECT i FROM Invoice i WHERE i.type NOT IN :excludedTypes " +
           "AND i.dueDate < :today AND i.paidAmount < i.amount " +
           "AND NOT EXISTS (SELECT c.id FROM Invoice c WHERE c.relatedInvoice = i AND c.type = :cancellation) " +
           "ORDER BY i.dueDate ASC, i.id ASC")
    List<Invoice> findOverdueInvoices(@Param("today") LocalDate today,
                                      @Param("excludedTypes") Collection<InvoiceType> excludedTypes,
                                      @Param("cancellation") InvoiceType cancellation);

    // Get invoice numbers of one year series (for auto-numbering)
    @Query("SELECT i.invoiceNumber FROM Invoice i WHERE i.invoiceNumber LIKE CONCAT(:prefix, '%')")
    List<String> findInvoiceNumbersStartingWith(@Param("prefix") String prefix);

    @Query("SELECT i FROM Invoice i WHERE i.issueDate >= :startDate AND i.issueDate <= :endDate " +
           "ORDER BY i.issueDate DESC, i.invoiceNumber DESC")
    List<Invoice> findByDateRange(@Param("startDate") LocalDate startDate,
                                  @Param("endDate") LocalDate endDate);

    List<Invoice> findByCustomerNameOrderByIssueDateDesc(String customerName);
}
