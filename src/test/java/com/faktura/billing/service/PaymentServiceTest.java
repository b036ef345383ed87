package com.faktura.billing.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceStatus;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.Payment;
import com.faktura.billing.domain.Payment.PaymentMethod;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.repository.PaymentRepository;
import com.faktura.billing.service.PaymentService.PaymentRequest;
import com.faktura.billing.service.PaymentService.PaymentResult;

/** Unit tests for PaymentService, focusing on status changes and overpayment handling. */
@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

  private static final LocalDate DUE = LocalDate.of(2024, 3, 15);

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private PaymentRepository paymentRepository;
  @Mock private AuditService auditService;

  private PaymentService paymentService;

  private Invoice invoice;

  @BeforeEach
  void setUp() {
    paymentService = new PaymentService(invoiceRepository, paymentRepository, auditService);

    invoice =
        new Invoice(
            "2024-0001", "Muster GmbH", InvoiceType.STANDARD, Money.of(1000), DUE.minusDays(14), DUE);
    invoice.setId(1L);
  }

  private void stubLoadAndSave() {
    when(invoiceRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));
    when(invoiceRepository.existsReversalOfType(1L, InvoiceType.CANCELLATION)).thenReturn(false);
    when(paymentRepository.save(any(Payment.class)))
        .thenAnswer(
            invocation -> {
              Payment payment = invocation.getArgument(0);
              payment.setId(10L);
              return payment;
            });
    when(invoiceRepository.saveAndFlush(any(Invoice.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  private PaymentRequest bank(String amount, LocalDate date) {
    return new PaymentRequest(date, new BigDecimal(amount), PaymentMethod.BANK, "SEPA-4711");
  }

  @Test
  void applyPayment_PartialBeforeDue_PartiallyPaid() {
    // Given
    stubLoadAndSave();
    LocalDate today = DUE.minusDays(3);

    // When
    PaymentResult result = paymentService.applyPayment(1L, bank("400.00", today), today, "anna");

    // Then
    assertEquals(Money.of("400.00"), invoice.getPaidAmount());
    assertEquals(InvoiceStatus.PARTIALLY_PAID, result.status());
    assertFalse(result.overpaymentWarning());
    assertEquals(10L, result.payment().getId());
    verify(auditService)
        .logEvent(eq("anna"), eq("PAYMENT_APPLIED"), eq("Invoice"), eq(1L), anyString());
  }

  @Test
  void applyPayment_RemainingBalance_Paid() {
    // Given
    stubLoadAndSave();
    invoice.setPaidAmount(Money.of(400));
    LocalDate today = DUE.plusDays(5);

    // When
    PaymentResult result = paymentService.applyPayment(1L, bank("600.00", today), today, "anna");

    // Then
    assertEquals(Money.of("1000.00"), invoice.getPaidAmount());
    assertEquals(InvoiceStatus.PAID, result.status());
    assertEquals(Money.ZERO, result.overpaidAmount());
  }

  @Test
  void applyPayment_PartialAfterDue_StaysOverdue() {
    stubLoadAndSave();
    LocalDate today = DUE.plusDays(3);

    PaymentResult result = paymentService.applyPayment(1L, bank("400.00", today), today, "anna");

    assertEquals(InvoiceStatus.OVERDUE, result.status());
  }

  @Test
  void applyPayment_WithinTolerance_AcceptedWithWarning() {
    // Given
    stubLoadAndSave();

    // When
    PaymentResult result = paymentService.applyPayment(1L, bank("1100.00", DUE), DUE, "anna");

    // Then
    assertTrue(result.overpaymentWarning());
    assertEquals(Money.of("100.00"), result.overpaidAmount());
    assertEquals(InvoiceStatus.PAID, result.status());
  }

  @Test
  void applyPayment_AboveTolerance_Rejected() {
    // Given
    when(invoiceRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));
    when(invoiceRepository.existsReversalOfType(1L, InvoiceType.CANCELLATION)).thenReturn(false);
    invoice.setPaidAmount(Money.of(500));

    // When
    OverpaymentException exception =
        assertThrows(
            OverpaymentException.class,
            () -> paymentService.applyPayment(1L, bank("550.01", DUE), DUE, "anna"));

    // Then
    assertEquals(Money.of("550.00"), exception.getMaximumAllowed());
    assertEquals(Money.of(500), invoice.getPaidAmount());
    verify(paymentRepository, never()).save(any());
    verify(invoiceRepository, never()).saveAndFlush(any());
  }

  @Test
  void applyPayment_AlreadyPaid_Rejected() {
    when(invoiceRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));
    when(invoiceRepository.existsReversalOfType(1L, InvoiceType.CANCELLATION)).thenReturn(false);
    invoice.setPaidAmount(Money.of(1000));

    assertThrows(
        InvalidStateTransitionException.class,
        () -> paymentService.applyPayment(1L, bank("10.00", DUE), DUE, "anna"));
    verify(paymentRepository, never()).save(any());
  }

  @Test
  void applyPayment_CancelledInvoice_Rejected() {
    when(invoiceRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));
    when(invoiceRepository.existsReversalOfType(1L, InvoiceType.CANCELLATION)).thenReturn(true);

    assertThrows(
        InvalidStateTransitionException.class,
        () -> paymentService.applyPayment(1L, bank("100.00", DUE), DUE, "anna"));
    verify(paymentRepository, never()).save(any());
  }

  @Test
  void applyPayment_ToCreditNote_Rejected() {
    invoice.setType(InvoiceType.CREDIT_NOTE);
    when(invoiceRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));

    assertThrows(
        InvalidStateTransitionException.class,
        () -> paymentService.applyPayment(1L, bank("100.00", DUE), DUE, "anna"));
  }

  @Test
  void applyPayment_NonPositiveAmount_RejectedBeforeLoading() {
    assertThrows(
        InvoiceValidationException.class,
        () -> paymentService.applyPayment(1L, bank("0.00", DUE), DUE, "anna"));
    assertThrows(
        InvoiceValidationException.class,
        () -> paymentService.applyPayment(1L, bank("-5.00", DUE), DUE, "anna"));
    verifyNoInteractions(invoiceRepository);
  }

  @Test
  void applyPayment_MissingMethod_Rejected() {
    PaymentRequest request = new PaymentRequest(DUE, new BigDecimal("10.00"), null, null);

    assertThrows(
        InvoiceValidationException.class,
        () -> paymentService.applyPayment(1L, request, DUE, "anna"));
  }

  @Test
  void applyPayment_UnknownInvoice_NotFound() {
    when(invoiceRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

    assertThrows(
        InvoiceNotFoundException.class,
        () -> paymentService.applyPayment(99L, bank("10.00", DUE), DUE, "anna"));
  }

  @Test
  void applyPayment_ConcurrentModification_Conflict() {
    when(invoiceRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(invoice));
    when(invoiceRepository.existsReversalOfType(1L, InvoiceType.CANCELLATION)).thenReturn(false);
    when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));
    when(invoiceRepository.saveAndFlush(any(Invoice.class)))
        .thenThrow(new OptimisticLockingFailureException("stale"));

    assertThrows(
        ConcurrencyConflictException.class,
        () -> paymentService.applyPayment(1L, bank("100.00", DUE), DUE, "anna"));
    verify(auditService, never()).logEvent(any(), any(), any(), any(), any());
  }
}
