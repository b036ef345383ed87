package com.faktura.billing.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DunningStateTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 5, 1);

  private DunningState state;

  @BeforeEach
  void setUp() {
    Invoice invoice =
        new Invoice(
            "2024-0001",
            "Muster GmbH",
            Invoice.InvoiceType.STANDARD,
            Money.of(1000),
            TODAY.minusDays(40),
            TODAY.minusDays(20));
    invoice.setId(1L);
    state = new DunningState(invoice);
  }

  private ReminderEntry entry(ReminderLevel level, String fee, String interest) {
    return new ReminderEntry(
        level,
        TODAY,
        TODAY.plusDays(14),
        20,
        Money.of(1000),
        new BigDecimal(fee),
        new BigDecimal(interest),
        Money.of(1000));
  }

  @Test
  void append_NextLevel_AdvancesLevelAndHistory() {
    state.append(entry(ReminderLevel.FRIENDLY, "0", "0"));
    state.append(entry(ReminderLevel.FIRST, "5", "0"));

    assertEquals(ReminderLevel.FIRST, state.getLevel());
    assertEquals(2, state.getHistory().size());
    assertEquals(TODAY, state.getLastReminderDate());
    assertSame(state, state.getHistory().get(1).getDunningState());
    assertTrue(state.hasReminderFor(ReminderLevel.FRIENDLY));
    assertFalse(state.hasReminderFor(ReminderLevel.SECOND));
  }

  @Test
  void append_SkippingLevel_Rejected() {
    assertThrows(
        IllegalStateException.class, () -> state.append(entry(ReminderLevel.FIRST, "5", "0")));
    assertEquals(ReminderLevel.NONE, state.getLevel());
    assertTrue(state.getHistory().isEmpty());
  }

  @Test
  void append_SameLevelTwice_Rejected() {
    state.append(entry(ReminderLevel.FRIENDLY, "0", "0"));

    assertThrows(
        IllegalStateException.class, () -> state.append(entry(ReminderLevel.FRIENDLY, "0", "0")));
    assertEquals(1, state.getHistory().size());
  }

  @Test
  void append_AfterLegal_Rejected() {
    state.append(entry(ReminderLevel.FRIENDLY, "0", "0"));
    state.append(entry(ReminderLevel.FIRST, "5", "0"));
    state.append(entry(ReminderLevel.SECOND, "10", "4.70"));
    state.append(entry(ReminderLevel.FINAL, "15", "2.01"));
    state.append(entry(ReminderLevel.LEGAL, "15", "3.36"));

    assertTrue(state.getLevel().isTerminal());
    assertThrows(
        IllegalStateException.class, () -> state.append(entry(ReminderLevel.LEGAL, "15", "0")));
  }

  @Test
  void totals_SumFeesAndInterestOfHistory() {
    state.append(entry(ReminderLevel.FRIENDLY, "0", "0"));
    state.append(entry(ReminderLevel.FIRST, "5", "0"));
    state.append(entry(ReminderLevel.SECOND, "10", "4.70"));

    assertEquals(Money.of("15.00"), state.getTotalFees());
    assertEquals(Money.of("4.70"), state.getTotalInterest());
  }

  @Test
  void history_IsReadOnly() {
    assertThrows(
        UnsupportedOperationException.class,
        () -> state.getHistory().add(entry(ReminderLevel.FRIENDLY, "0", "0")));
  }
}
