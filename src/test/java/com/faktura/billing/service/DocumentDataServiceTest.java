package com.faktura.billing.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.faktura.billing.domain.DunningState;
import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceStatus;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.Payment;
import com.faktura.billing.domain.Payment.PaymentMethod;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderLevel;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.repository.PaymentRepository;
import com.faktura.billing.repository.ReminderEntryRepository;
import com.faktura.billing.service.DocumentDataService.DocumentData;

@ExtendWith(MockitoExtension.class)
class DocumentDataServiceTest {

  private static final LocalDate ISSUED = LocalDate.of(2024, 3, 1);

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private PaymentRepository paymentRepository;
  @Mock private ReminderEntryRepository reminderEntryRepository;
  @Mock private ProjectBillingService projectBillingService;

  private DocumentDataService documentDataService;

  @BeforeEach
  void setUp() {
    documentDataService =
        new DocumentDataService(
            invoiceRepository, paymentRepository, reminderEntryRepository, projectBillingService);
  }

  private Invoice invoice(long id, String number, InvoiceType type, long amount) {
    Invoice invoice =
        new Invoice(number, "Muster GmbH", type, Money.of(amount), ISSUED, ISSUED.plusDays(14));
    invoice.setId(id);
    return invoice;
  }

  @Test
  void forInvoice_WithPayment_DeductsPayment() {
    // Given
    Invoice invoice = invoice(1L, "2024-0001", InvoiceType.STANDARD, 1000);
    Payment payment =
        new Payment(invoice, LocalDate.of(2024, 3, 10), Money.of(300), PaymentMethod.BANK, "Ref 1");
    when(invoiceRepository.findById(1L)).thenReturn(Optional.of(invoice));
    when(paymentRepository.findByInvoiceOrderByPaymentDateAscIdAsc(invoice)).thenReturn(List.of(payment));

    // When
    DocumentData data = documentDataService.forInvoice(1L);

    // Then
    assertEquals("Rechnung", data.title());
    assertEquals(2, data.lines().size());
    assertEquals("Zahlung vom 10.03.2024", data.lines().get(1).description());
    assertEquals(Money.of(-300), data.lines().get(1).amount());
    assertEquals(Money.of(700), data.total());
    assertTrue(data.previousInvoices().isEmpty());
    verifyNoInteractions(projectBillingService);
  }

  @Test
  void forInvoice_FinalSettlement_ListsDownPaymentsWithoutDeductingThem() {
    // Given
    Invoice settlement = invoice(3L, "2024-0003", InvoiceType.FINAL_SETTLEMENT, 10000);
    settlement.setProjectId("P-7");
    Invoice downPayment = invoice(1L, "2024-0001", InvoiceType.DOWN_PAYMENT, 4000);
    downPayment.setPaidAmount(Money.of(4000));
    when(invoiceRepository.findById(3L)).thenReturn(Optional.of(settlement));
    when(projectBillingService.summarize("P-7"))
        .thenReturn(
            new ProjectBillingSummary(
                "P-7", List.of(downPayment), settlement, Money.of(4000), Money.of(10000),
                Money.of(14000), Money.of(6000), false, Money.of(14000), Money.of(4000),
                Money.of(10000)));
    when(paymentRepository.findByInvoiceOrderByPaymentDateAscIdAsc(settlement)).thenReturn(List.of());

    // When
    DocumentData data = documentDataService.forInvoice(3L);

    // Then
    assertEquals("Schlussrechnung", data.title());
    assertEquals(1, data.lines().size());
    assertEquals(
        "Abschlagsrechnung 2024-0001 vom 01.03.2024", data.previousInvoices().get(0).description());
    assertEquals(Money.of(4000), data.previousInvoices().get(0).amount());
    assertEquals(Money.of(10000), data.total());

    // The customer paying the printed total settles the invoice
    settlement.setPaidAmount(data.total());
    assertEquals(InvoiceStatus.PAID, settlement.getStatus(ISSUED.plusDays(30)));
    assertEquals(Money.ZERO, settlement.getBalance());
  }

  @Test
  void forInvoice_Cancellation_ReferencesOriginal() {
    Invoice original = invoice(1L, "2024-0001", InvoiceType.STANDARD, 1000);
    Invoice storno = invoice(2L, "2024-0002-S", InvoiceType.CANCELLATION, 1000);
    storno.setRelatedInvoice(original);
    storno.setReversalReason("Falscher Empfänger");
    when(invoiceRepository.findById(2L)).thenReturn(Optional.of(storno));

    DocumentData data = documentDataService.forInvoice(2L);

    assertEquals("Stornorechnung", data.title());
    assertEquals("2024-0001", data.reference());
    assertEquals("Falscher Empfänger", data.note());
    assertEquals(Money.of(-1000), data.total());
    verifyNoInteractions(paymentRepository);
  }

  @Test
  void forReminder_SecondReminder_ListsEarlierFeesOnly() {
    // Given
    Invoice invoice = invoice(1L, "2024-0001", InvoiceType.STANDARD, 1000);
    DunningState state = new DunningState(invoice);
    LocalDate day = ISSUED.plusDays(20);
    state.append(
        new ReminderEntry(ReminderLevel.FRIENDLY, day, day.plusDays(14), 6, Money.of(1000), Money.ZERO,
            Money.ZERO, Money.of(1000)));
    state.append(
        new ReminderEntry(ReminderLevel.FIRST, day.plusDays(14), day.plusDays(28), 20, Money.of(1000),
            Money.of(5), Money.ZERO, Money.of(1005)));
    ReminderEntry second =
        new ReminderEntry(ReminderLevel.SECOND, day.plusDays(28), day.plusDays(42), 34, Money.of(1000),
            Money.of(10), Money.of("4.70"), Money.of("1019.70"));
    state.append(second);
    state.append(
        new ReminderEntry(ReminderLevel.FINAL, day.plusDays(42), day.plusDays(56), 48, Money.of(1000),
            Money.of(15), Money.of("2.00"), Money.of("1036.70")));
    when(reminderEntryRepository.findById(7L)).thenReturn(Optional.of(second));

    // When
    DocumentData data = documentDataService.forReminder(7L);

    // Then
    assertEquals("2. Mahnung", data.title());
    assertEquals(
        List.of(
            "Offener Betrag Rechnung 2024-0001",
            "Mahngebühr 1. Mahnung",
            "Mahngebühr 2. Mahnung",
            "Verzugszinsen 2. Mahnung"),
        data.lines().stream().map(DocumentData.DocumentLine::description).toList());
    assertEquals(Money.of("1019.70"), data.total());
  }
}
