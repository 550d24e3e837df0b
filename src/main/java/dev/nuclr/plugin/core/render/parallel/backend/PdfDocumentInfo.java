package dev.nuclr.plugin.core.render.parallel.backend;

/**
 * Metadata about an opened PDF document.
 */
public record PdfDocumentInfo(
        String title,
        String author,
        int pageCount,
        String pdfVersion,
        long sizeBytes) {}
