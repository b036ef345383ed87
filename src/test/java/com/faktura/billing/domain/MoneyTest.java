package com.faktura.billing.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class MoneyTest {

  @Test
  void normalize_RoundsHalfUpToCents() {
    assertEquals(new BigDecimal("10.13"), Money.normalize(new BigDecimal("10.125")));
    assertEquals(new BigDecimal("10.12"), Money.normalize(new BigDecimal("10.1249")));
    assertEquals(Money.ZERO, Money.normalize(null));
  }

  @Test
  void subtractFloorZero_NeverNegative() {
    assertEquals(Money.of("600.00"), Money.subtractFloorZero(Money.of(1000), Money.of(400)));
    assertEquals(Money.ZERO, Money.subtractFloorZero(Money.of(100), Money.of(250)));
  }

  @Test
  void percentOf_OverpaymentWindow() {
    assertEquals(Money.of("1100.00"), Money.percentOf(Money.of(1000), BigDecimal.valueOf(110)));
    assertEquals(Money.of("366.66"), Money.percentOf(Money.of("333.33"), BigDecimal.valueOf(110)));
  }

  @Test
  void daysOverdue_CountsCalendarDaysPastDue() {
    LocalDate due = LocalDate.of(2024, 2, 28);

    assertEquals(0, DayCount.daysOverdue(due, due));
    assertEquals(0, DayCount.daysOverdue(due, due.minusDays(5)));
    // 2024 is a leap year
    assertEquals(2, DayCount.daysOverdue(due, LocalDate.of(2024, 3, 1)));
    assertTrue(DayCount.isPastDue(due, due.plusDays(1)));
    assertFalse(DayCount.isPastDue(due, due));
  }
}
