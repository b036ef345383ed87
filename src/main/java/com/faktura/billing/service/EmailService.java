package com.faktura.billing.service;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import com.faktura.billing.domain.Invoice;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

/**
 * Delivers reminder mails to the customer of an invoice.
 *
 * <p>With faktura.email.enabled=false nothing leaves the system and the result is DISABLED. When
 * mail is enabled but no JavaMailSender is configured (no spring.mail.host), the mail is recorded
 * in the audit trail as queued. Every mail that is sent or queued is audited against its invoice.
 */
@Service
public class EmailService {

  private static final Logger log = LoggerFactory.getLogger(EmailService.class);

  private static final Pattern ADDRESS = Pattern.compile("^[A-Za-z0-9+_.-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

  static final String INVOICE_HEADER = "X-Faktura-Invoice";

  @Value("${faktura.email.enabled:false}")
  private boolean emailEnabled;

  @Value("${faktura.email.from-address:noreply@faktura.local}")
  private String fromAddress;

  @Value("${faktura.email.from-name:Faktura}")
  private String fromName;

  private final AuditService auditService;
  private final JavaMailSender mailSender;

  @Autowired
  public EmailService(
      AuditService auditService, @Autowired(required = false) JavaMailSender mailSender) {
    this.auditService = auditService;
    this.mailSender = mailSender;
  }

  public enum DeliveryStatus {
    SENT,
    QUEUED,
    DISABLED,
    FAILED,
    INVALID_RECIPIENT;

    /** Whether the mail was handed over for delivery. */
    public boolean delivered() {
      return this == SENT || this == QUEUED;
    }
  }

  public record EmailResult(DeliveryStatus status, String message, String messageId) {
    public boolean success() {
      return status.delivered();
    }

    static EmailResult sent(String messageId) {
      return new EmailResult(DeliveryStatus.SENT, "Reminder sent", messageId);
    }

    static EmailResult queued(String messageId) {
      return new EmailResult(DeliveryStatus.QUEUED, "Reminder queued, no mail server configured", messageId);
    }

    static EmailResult disabled() {
      return new EmailResult(DeliveryStatus.DISABLED, "Email sending is switched off", null);
    }

    static EmailResult failed(String reason) {
      return new EmailResult(DeliveryStatus.FAILED, reason, null);
    }

    static EmailResult invalidRecipient(String reason) {
      return new EmailResult(DeliveryStatus.INVALID_RECIPIENT, reason, null);
    }
  }

  /** A rendered reminder addressed to the customer of one invoice. */
  public record ReminderMail(Invoice invoice, String subject, String body, String actor) {}

  public EmailResult sendReminder(Invoice invoice, String subject, String body, String actor) {
    return send(new ReminderMail(invoice, subject, body, actor));
  }

  /**
   * Sends a reminder mail.
   *
   * @return the outcome; SMTP and composition errors are reported as FAILED, never thrown
   */
  public EmailResult send(ReminderMail mail) {
    Invoice invoice = mail.invoice();
    String recipient = invoice.getCustomerEmail();
    if (recipient == null || recipient.isBlank()) {
      return EmailResult.invalidRecipient("Customer has no email address");
    }
    if (!ADDRESS.matcher(recipient).matches()) {
      return EmailResult.invalidRecipient("Invalid email address: " + recipient);
    }
    if (isBlank(mail.subject()) || isBlank(mail.body())) {
      return EmailResult.failed("Reminder for invoice " + invoice.getInvoiceNumber() + " has no text");
    }

    if (!emailEnabled) {
      log.info("Email disabled, reminder for invoice {} to {} not sent", invoice.getInvoiceNumber(), recipient);
      return EmailResult.disabled();
    }

    String messageId = newMessageId(invoice);
    if (mailSender == null) {
      log.warn("No mail server configured, reminder for invoice {} to {} queued as {}",
          invoice.getInvoiceNumber(), recipient, messageId);
      audit(mail, "EMAIL_QUEUED", messageId);
      return EmailResult.queued(messageId);
    }

    try {
      MimeMessage message = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
      helper.setFrom(fromAddress, fromName);
      helper.setTo(new InternetAddress(recipient, invoice.getCustomerName(), StandardCharsets.UTF_8.name()));
      helper.setSubject(mail.subject());
      helper.setText(mail.body());
      message.setHeader(INVOICE_HEADER, invoice.getInvoiceNumber());

      mailSender.send(message);
    } catch (MessagingException | UnsupportedEncodingException e) {
      log.error("Could not compose reminder for invoice {}: {}", invoice.getInvoiceNumber(), e.getMessage(), e);
      return EmailResult.failed("Could not compose reminder: " + e.getMessage());
    } catch (MailException e) {
      log.error("Could not send reminder for invoice {} to {}: {}",
          invoice.getInvoiceNumber(), recipient, e.getMessage(), e);
      return EmailResult.failed("Mail server rejected reminder: " + e.getMessage());
    }

    log.info("Reminder for invoice {} sent to {} [{}]", invoice.getInvoiceNumber(), recipient, messageId);
    audit(mail, "EMAIL_SENT", messageId);
    return EmailResult.sent(messageId);
  }

  public boolean isEmailEnabled() {
    return emailEnabled;
  }

  private void audit(ReminderMail mail, String eventType, String messageId) {
    Invoice invoice = mail.invoice();
    auditService.logEvent(
        mail.actor() != null ? mail.actor() : "system",
        eventType,
        "Invoice",
        invoice.getId(),
        "\"" + mail.subject() + "\" to " + invoice.getCustomerEmail() + " [" + messageId + "]");
  }

  private static String newMessageId(Invoice invoice) {
    return "reminder-" + invoice.getInvoiceNumber() + "-" + UUID.randomUUID();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
