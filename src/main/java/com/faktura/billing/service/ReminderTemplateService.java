package com.faktura.billing.service;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderLevel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default German subject and body texts for each reminder level.
 *
 * Placeholders are written as {name}; unknown placeholders are left as they are.
 */
@Service
public class ReminderTemplateService {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z]+)}");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    public record ReminderTemplate(String subject, String body) {}

    public record RenderedReminder(String subject, String body) {}

    private static final Map<ReminderLevel, ReminderTemplate> DEFAULT_TEMPLATES = new EnumMap<>(ReminderLevel.class);

    static {
        DEFAULT_TEMPLATES.put(ReminderLevel.FRIENDLY, new ReminderTemplate(
            "Zahlungserinnerung zu Rechnung {invoiceNumber}",
            """
            Sehr geehrte Damen und Herren, liebe/r {customerName},

            sicher ist es Ihrer Aufmerksamkeit entgangen, dass unsere Rechnung {invoiceNumber} \
            vom {invoiceDate} über {amount} am {dueDate} fällig war.

            Wir bitten Sie, den Betrag bis zum {paymentDueDate} zu überweisen. \
            Sollten Sie die Zahlung bereits veranlasst haben, betrachten Sie dieses Schreiben als gegenstandslos.

            Mit freundlichen Grüßen
            {companyName}
            """));
        DEFAULT_TEMPLATES.put(ReminderLevel.FIRST, new ReminderTemplate(
            "1. Mahnung zu Rechnung {invoiceNumber}",
            """
            Sehr geehrte Damen und Herren, liebe/r {customerName},

            leider konnten wir zu unserer Rechnung {invoiceNumber} vom {invoiceDate} über {amount} \
            noch keinen Zahlungseingang feststellen. Die Rechnung war am {dueDate} fällig.

            Für diese Mahnung berechnen wir eine Gebühr von {reminderFee}. \
            Bitte überweisen Sie den Gesamtbetrag von {totalAmount} bis zum {paymentDueDate}.

            Mit freundlichen Grüßen
            {companyName}
            """));
        DEFAULT_TEMPLATES.put(ReminderLevel.SECOND, new ReminderTemplate(
            "2. Mahnung zu Rechnung {invoiceNumber}",
            """
            Sehr geehrte Damen und Herren, liebe/r {customerName},

            trotz unserer Mahnung ist die Rechnung {invoiceNumber} vom {invoiceDate} über {amount} \
            weiterhin offen.

            Mahngebühren bisher: {totalReminderFees}
            Verzugszinsen: {interestAmount}
            Gesamtbetrag: {totalAmount}

            Wir fordern Sie auf, den Gesamtbetrag bis spätestens {paymentDueDate} zu begleichen.

            Mit freundlichen Grüßen
            {companyName}
            """));
        DEFAULT_TEMPLATES.put(ReminderLevel.FINAL, new ReminderTemplate(
            "Letzte Mahnung zu Rechnung {invoiceNumber}",
            """
            Sehr geehrte Damen und Herren, liebe/r {customerName},

            die Rechnung {invoiceNumber} vom {invoiceDate} über {amount} ist trotz mehrfacher \
            Mahnung noch immer nicht beglichen.

            Mahngebühren: {totalReminderFees}
            Verzugszinsen: {interestAmount}
            Gesamtbetrag: {totalAmount}

            Dies ist die letzte Mahnung vor rechtlichen Schritten. Geht der Gesamtbetrag nicht bis \
            zum {paymentDueDate} bei uns ein, leiten wir ohne weitere Ankündigung das gerichtliche \
            Mahnverfahren ein.

            Mit freundlichen Grüßen
            {companyName}
            """));
        DEFAULT_TEMPLATES.put(ReminderLevel.LEGAL, new ReminderTemplate(
            "Übergabe an das gerichtliche Mahnverfahren: Rechnung {invoiceNumber}",
            """
            Sehr geehrte Damen und Herren, liebe/r {customerName},

            da die Rechnung {invoiceNumber} vom {invoiceDate} trotz letzter Mahnung nicht bezahlt \
            wurde, haben wir die Forderung über {totalAmount} an das gerichtliche Mahnverfahren \
            übergeben.

            Mit freundlichen Grüßen
            {companyName}
            """));
    }

    @Value("${faktura.company.name:Faktura}")
    private String companyName;

    public ReminderTemplate getTemplate(ReminderLevel level) {
        ReminderTemplate template = DEFAULT_TEMPLATES.get(level);
        if (template == null) {
            throw new IllegalArgumentException("No reminder template for level " + level);
        }
        return template;
    }

    /**
     * Renders the template of the reminder's level with the invoice's data.
     *
     * @param totalReminderFees fees of this and all earlier reminders of the invoice
     */
    public RenderedReminder render(Invoice invoice, ReminderEntry reminder, BigDecimal totalReminderFees) {
        ReminderTemplate template = getTemplate(reminder.getLevel());
        Map<String, String> values = variables(invoice, reminder, totalReminderFees);
        return new RenderedReminder(replace(template.subject(), values), replace(template.body(), values));
    }

    Map<String, String> variables(Invoice invoice, ReminderEntry reminder, BigDecimal totalReminderFees) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("customerName", invoice.getCustomerName());
        values.put("invoiceNumber", invoice.getInvoiceNumber());
        values.put("invoiceDate", formatDate(invoice.getIssueDate()));
        values.put("dueDate", formatDate(invoice.getDueDate()));
        values.put("amount", formatAmount(invoice.getAmount()));
        values.put("reminderFee", formatAmount(reminder.getFee()));
        values.put("interestAmount", formatAmount(reminder.getInterest()));
        values.put("totalReminderFees", formatAmount(totalReminderFees));
        values.put("totalAmount", formatAmount(reminder.getTotalAmount()));
        values.put("paymentDueDate", formatDate(reminder.getPaymentDueDate()));
        values.put("daysOverdue", String.valueOf(reminder.getDaysOverdue()));
        values.put("companyName", companyName);
        return values;
    }

    static String replace(String text, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatAmount(BigDecimal amount) {
        NumberFormat format = NumberFormat.getCurrencyInstance(Locale.GERMANY);
        return format.format(amount != null ? amount : BigDecimal.ZERO);
    }

    private static String formatDate(LocalDate date) {
        return date != null ? DATE_FORMAT.format(date) : "";
    }
}
