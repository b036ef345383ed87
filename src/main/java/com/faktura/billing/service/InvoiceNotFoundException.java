package com.faktura.billing.service;

public class InvoiceNotFoundException extends IllegalArgumentException {

    public InvoiceNotFoundException(Long invoiceId) {
        super("Invoice not found: " + invoiceId);
    }
}
