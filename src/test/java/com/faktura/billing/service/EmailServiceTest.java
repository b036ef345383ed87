package com.faktura.billing.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.time.LocalDate;
import java.util.Properties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.service.EmailService.DeliveryStatus;
import com.faktura.billing.service.EmailService.EmailResult;

import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

@ExtendWith(MockitoExtension.class)
class EmailServiceTest {

  private static final String SUBJECT = "Zahlungserinnerung zu Rechnung 2024-0001";

  @Mock private AuditService auditService;
  @Mock private JavaMailSender mailSender;

  private EmailService emailService;
  private Invoice invoice;

  @BeforeEach
  void setUp() {
    emailService = configured(new EmailService(auditService, mailSender), true);

    LocalDate due = LocalDate.of(2024, 3, 1);
    invoice =
        new Invoice("2024-0001", "Müller & Söhne GmbH", InvoiceType.STANDARD, Money.of(1000), due, due);
    invoice.setId(1L);
    invoice.setCustomerEmail("buchhaltung@mueller.de");
  }

  private static EmailService configured(EmailService service, boolean enabled) {
    ReflectionTestUtils.setField(service, "emailEnabled", enabled);
    ReflectionTestUtils.setField(service, "fromAddress", "mahnwesen@faktura.local");
    ReflectionTestUtils.setField(service, "fromName", "Holzbau Meier");
    return service;
  }

  @Test
  void sendReminder_Enabled_SendsToCustomerAndAudits() throws Exception {
    // Given
    MimeMessage message = new MimeMessage(Session.getInstance(new Properties()));
    when(mailSender.createMimeMessage()).thenReturn(message);

    // When
    EmailResult result = emailService.sendReminder(invoice, SUBJECT, "Bitte überweisen Sie.", "anna");

    // Then
    assertTrue(result.success());
    assertEquals(DeliveryStatus.SENT, result.status());
    assertTrue(result.messageId().startsWith("reminder-2024-0001-"));
    verify(mailSender).send(message);

    assertEquals(SUBJECT, message.getSubject());
    InternetAddress to = (InternetAddress) message.getAllRecipients()[0];
    assertEquals("buchhaltung@mueller.de", to.getAddress());
    assertEquals("Müller & Söhne GmbH", to.getPersonal());
    assertEquals("2024-0001", message.getHeader(EmailService.INVOICE_HEADER)[0]);

    verify(auditService)
        .logEvent(eq("anna"), eq("EMAIL_SENT"), eq("Invoice"), eq(1L), contains(result.messageId()));
  }

  @Test
  void sendReminder_Disabled_NothingSentNorAudited() {
    configured(emailService, false);

    EmailResult result = emailService.sendReminder(invoice, SUBJECT, "Text", "anna");

    assertFalse(result.success());
    assertEquals(DeliveryStatus.DISABLED, result.status());
    assertNull(result.messageId());
    verifyNoInteractions(mailSender, auditService);
  }

  @Test
  void sendReminder_NoMailServer_QueuedAndAudited() {
    EmailService withoutSender = configured(new EmailService(auditService, null), true);

    EmailResult result = withoutSender.sendReminder(invoice, SUBJECT, "Text", null);

    assertTrue(result.success());
    assertEquals(DeliveryStatus.QUEUED, result.status());
    verify(auditService)
        .logEvent(eq("system"), eq("EMAIL_QUEUED"), eq("Invoice"), eq(1L), anyString());
  }

  @Test
  void sendReminder_SmtpFailure_ReportedAsFailed() {
    when(mailSender.createMimeMessage())
        .thenReturn(new MimeMessage(Session.getInstance(new Properties())));
    doThrow(new MailSendException("Connection refused")).when(mailSender).send(any(MimeMessage.class));

    EmailResult result = emailService.sendReminder(invoice, SUBJECT, "Text", "anna");

    assertFalse(result.success());
    assertEquals(DeliveryStatus.FAILED, result.status());
    assertTrue(result.message().contains("Connection refused"));
    verifyNoInteractions(auditService);
  }

  @Test
  void sendReminder_CustomerWithoutEmail_InvalidRecipient() {
    invoice.setCustomerEmail(null);

    EmailResult result = emailService.sendReminder(invoice, SUBJECT, "Text", "anna");

    assertEquals(DeliveryStatus.INVALID_RECIPIENT, result.status());
    assertEquals("Customer has no email address", result.message());
    verifyNoInteractions(mailSender);
  }

  @Test
  void sendReminder_MalformedAddress_InvalidRecipient() {
    invoice.setCustomerEmail("buchhaltung-at-mueller");

    assertEquals(
        DeliveryStatus.INVALID_RECIPIENT,
        emailService.sendReminder(invoice, SUBJECT, "Text", "anna").status());
  }

  @Test
  void sendReminder_EmptyBody_Failed() {
    EmailResult result = emailService.sendReminder(invoice, SUBJECT, " ", "anna");

    assertEquals(DeliveryStatus.FAILED, result.status());
    verifyNoInteractions(mailSender);
  }
}
