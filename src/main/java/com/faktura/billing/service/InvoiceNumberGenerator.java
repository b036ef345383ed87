package com.faktura.billing.service;

import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.repository.InvoiceRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Generates yearly sequential document numbers: {@code 2024-0001}.
 * Cancellations get the suffix {@code -S}, credit notes {@code -G}; all document
 * types share one sequence per year.
 */
@Component
public class InvoiceNumberGenerator {

    private final InvoiceRepository invoiceRepository;

    public InvoiceNumberGenerator(InvoiceRepository invoiceRepository) {
        this.invoiceRepository = invoiceRepository;
    }

    public String nextNumber(InvoiceType type, LocalDate issueDate) {
        String prefix = issueDate.getYear() + "-";
        List<String> existingNumbers = invoiceRepository.findInvoiceNumbersStartingWith(prefix);
        int maxNumber = 0;
        for (String num : existingNumbers) {
            int sequence = parseSequence(num, prefix);
            if (sequence > maxNumber) {
                maxNumber = sequence;
            }
        }
        return prefix + String.format("%04d", maxNumber + 1) + suffixFor(type);
    }

    static String suffixFor(InvoiceType type) {
        return switch (type) {
            case CANCELLATION -> "-S";
            case CREDIT_NOTE -> "-G";
            default -> "";
        };
    }

    private int parseSequence(String number, String prefix) {
        String rest = number.substring(prefix.length());
        int dash = rest.indexOf('-');
        String digits = dash >= 0 ? rest.substring(0, dash) : rest;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ignored) {
            // Manually entered numbers outside the series do not advance it
            return 0;
        }
    }
}
