package dev.nuclr.plugin.core.render.parallel.backend;

/**
 * Source handle for parallel rendering: one open document whose pages are
 * loaded and drawn by worker threads.
 *
 * <p>Implementations are not required to be thread-safe. Every call to
 * {@link #loadPage(int)} and every method of the returned {@link LoadedPage}
 * is made while the caller holds {@link #lock()}. {@link #pageCount()} and
 * {@link #sizeBytes()} must be safe to call without the lock.
 */
public interface RenderDocument {

    /** Human-readable name for logging. */
    String name();

    /** Number of pages in the document. */
    int pageCount();

    /** Size of the encoded document in bytes, or 0 when unknown. */
    long sizeBytes();

    /** The lock guarding every page load, render and close on this document. */
    DocumentLock lock();

    /**
     * Load one page. Must be called with {@link #lock()} held.
     *
     * @param pageIndex 0-based page index
     * @return the loaded page, or null if the page cannot be loaded
     * @throws Exception for parse or I/O errors, treated like a null return
     */
    LoadedPage loadPage(int pageIndex) throws Exception;

    /** Thrown when the PDF requires a password. */
    class EncryptedPdfException extends Exception {
        public EncryptedPdfException() {
            super("Encrypted PDF \u2013 cannot render");
        }
    }
}
