package com.faktura.billing.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.test.util.ReflectionTestUtils;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderLevel;
import com.faktura.billing.service.ReminderTemplateService.RenderedReminder;

class ReminderTemplateServiceTest {

  private ReminderTemplateService templateService;
  private Invoice invoice;

  @BeforeEach
  void setUp() {
    templateService = new ReminderTemplateService();
    ReflectionTestUtils.setField(templateService, "companyName", "Holzbau Meier");

    invoice =
        new Invoice(
            "2024-0042",
            "Muster GmbH",
            InvoiceType.STANDARD,
            Money.of(1000),
            LocalDate.of(2024, 1, 1),
            LocalDate.of(2024, 1, 15));
  }

  private ReminderEntry reminder(ReminderLevel level, String fee, String interest, String total) {
    return new ReminderEntry(
        level,
        LocalDate.of(2024, 2, 20),
        LocalDate.of(2024, 3, 5),
        36,
        Money.of(1000),
        new BigDecimal(fee),
        new BigDecimal(interest),
        new BigDecimal(total));
  }

  @Test
  void render_FirstReminder_FillsInvoiceData() {
    // Given
    ReminderEntry first = reminder(ReminderLevel.FIRST, "5.00", "0.00", "1005.00");

    // When
    RenderedReminder rendered = templateService.render(invoice, first, Money.of(5));

    // Then
    assertEquals("1. Mahnung zu Rechnung 2024-0042", rendered.subject());
    assertTrue(rendered.body().contains("Muster GmbH"));
    assertTrue(rendered.body().contains("vom 01.01.2024"));
    assertTrue(rendered.body().contains("am 15.01.2024"));
    assertTrue(rendered.body().contains("bis zum 05.03.2024"));
    assertTrue(rendered.body().contains("1.005,00"));
    assertTrue(rendered.body().contains("Holzbau Meier"));
    assertFalse(rendered.body().contains("{"));
  }

  @Test
  void render_SecondReminder_ShowsAccumulatedFees() {
    ReminderEntry second = reminder(ReminderLevel.SECOND, "10.00", "4.70", "1019.70");

    RenderedReminder rendered = templateService.render(invoice, second, Money.of(15));

    assertTrue(rendered.body().contains("Mahngebühren bisher: " + ReminderTemplateService.formatAmount(Money.of(15))));
    assertTrue(rendered.body().contains("4,70"));
    assertTrue(rendered.body().contains("1.019,70"));
  }

  @ParameterizedTest
  @EnumSource(value = ReminderLevel.class, names = "NONE", mode = EnumSource.Mode.EXCLUDE)
  void getTemplate_EveryReminderLevel_HasTemplate(ReminderLevel level) {
    assertNotNull(templateService.getTemplate(level).subject());
  }

  @Test
  void getTemplate_None_Rejected() {
    assertThrows(IllegalArgumentException.class, () -> templateService.getTemplate(ReminderLevel.NONE));
  }

  @Test
  void replace_UnknownPlaceholder_LeftAsIs() {
    String result =
        ReminderTemplateService.replace(
            "Hallo {customerName}, siehe {attachment}", Map.of("customerName", "Anna $1"));

    assertEquals("Hallo Anna $1, siehe {attachment}", result);
  }
}
