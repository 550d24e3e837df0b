package dev.nuclr.plugin.core.render.parallel.backend;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.Graphics2D;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link RenderDocument} backed by Apache PDFBox 3.x.
 *
 * <p>A {@link PDDocument} and its {@link PDFRenderer} share font, image and
 * colour-space caches across pages and are not safe for concurrent use; every
 * page operation runs under {@link #lock()}.
 */
@Slf4j
public final class PdfboxDocument implements RenderDocument, Closeable {

    private final String name;
    private final long sizeBytes;
    private final DocumentLock lock = new DocumentLock();
    private final PDDocument document;
    private final PDFRenderer renderer;
    private final PdfDocumentInfo info;

    private PdfboxDocument(String name, PDDocument document, long sizeBytes) {
        this.name = name;
        this.document = document;
        this.sizeBytes = sizeBytes;
        this.renderer = new PDFRenderer(document);
        this.renderer.setSubsamplingAllowed(true);

        PDDocumentInformation docInfo = document.getDocumentInformation();
        String title  = sanitize(docInfo != null ? docInfo.getTitle()  : null);
        String author = sanitize(docInfo != null ? docInfo.getAuthor() : null);
        String ver    = String.format("PDF %.1f", document.getVersion());
        this.info = new PdfDocumentInfo(title, author, document.getNumberOfPages(), ver, sizeBytes);

        log.info("Opened PDF via PDFBox: {} ({} pages, {}, {} bytes)", name, info.pageCount(), ver, sizeBytes);
    }

    /**
     * Open a PDF from raw bytes.
     *
     * @throws EncryptedPdfException if the PDF requires a password
     * @throws IOException           for I/O or format errors
     */
    public static PdfboxDocument open(String name, byte[] pdfBytes) throws IOException, EncryptedPdfException {
        try {
            return new PdfboxDocument(name, Loader.loadPDF(pdfBytes), pdfBytes.length);
        } catch (InvalidPasswordException e) {
            throw new EncryptedPdfException();
        }
    }

    public static PdfboxDocument open(Path file) throws IOException, EncryptedPdfException {
        return open(file.getFileName().toString(), Files.readAllBytes(file));
    }

    public PdfDocumentInfo info() {
        return info;
    }

    // ---------------------------------------------------- RenderDocument impl

    @Override
    public String name() {
        return name;
    }

    @Override
    public int pageCount() {
        return info.pageCount();
    }

    @Override
    public long sizeBytes() {
        return sizeBytes;
    }

    @Override
    public DocumentLock lock() {
        return lock;
    }

    @Override
    public LoadedPage loadPage(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= info.pageCount()) return null;
        return new PdfboxPage(pageIndex, document.getPage(pageIndex));
    }

    @Override
    public void close() {
        try (DocumentLock.Guard ignored = lock.acquire()) {
            document.close();
        } catch (IOException e) {
            log.warn("Error closing PDDocument {}", name, e);
        }
    }

    private static String sanitize(String s) {
        return (s != null && !s.isBlank()) ? s.trim() : null;
    }

    // ------------------------------------------------------------ page handle

    private final class PdfboxPage implements LoadedPage {

        private final int pageIndex;
        private PDPage page;

        PdfboxPage(int pageIndex, PDPage page) {
            this.pageIndex = pageIndex;
            this.page = page;
        }

        @Override
        public int pageIndex() {
            return pageIndex;
        }

        @Override
        public float widthPoints() {
            PDRectangle box = page().getCropBox();
            return isQuarterTurned() ? box.getHeight() : box.getWidth();
        }

        @Override
        public float heightPoints() {
            PDRectangle box = page().getCropBox();
            return isQuarterTurned() ? box.getWidth() : box.getHeight();
        }

        @Override
        public boolean hasTransparency() {
            COSDictionary group = page().getCOSObject().getCOSDictionary(COSName.GROUP);
            return group != null && COSName.TRANSPARENCY.equals(group.getCOSName(COSName.S));
        }

        @Override
        public void render(Graphics2D graphics, float scaleX, float scaleY) throws IOException {
            page();
            log.debug("PDFBox: rendering page {} of {} at {}x{}", pageIndex, name, scaleX, scaleY);
            renderer.renderPageToGraphics(pageIndex, graphics, scaleX, scaleY);
        }

        @Override
        public void close() {
            page = null;
        }

        private boolean isQuarterTurned() {
            return page().getRotation() % 180 != 0;
        }

        private PDPage page() {
            if (page == null) throw new IllegalStateException("Page " + pageIndex + " already closed");
            return page;
        }
    }
}
