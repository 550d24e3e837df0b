package dev.nuclr.plugin.core.render.parallel;

import dev.nuclr.plugin.core.render.parallel.backend.FormOverlay;
import dev.nuclr.plugin.core.render.parallel.pool.OutputFormat;
import lombok.Builder;

/**
 * Per-batch options for {@link ParallelRenderer}.
 *
 * @param workerCount      number of workers, 0 to let {@link WorkerCountEstimator} decide
 * @param maxQueueDepth    ceiling on outstanding pages, 0 for the automatic default
 * @param outputFormat     pixel layout of the rendered bitmaps
 * @param rotation         quarter turns clockwise, normalised to 0..3
 * @param dpi              resolution for pooled batches submitted with a 0x0 size
 * @param formOverlay      optional form-field layer, may be null
 * @param keepWorkerCaches leave pooled bitmaps in the workers after the batch
 */
@Builder(toBuilder = true)
public record RenderOptions(
        int workerCount,
        int maxQueueDepth,
        OutputFormat outputFormat,
        int rotation,
        double dpi,
        FormOverlay formOverlay,
        boolean keepWorkerCaches) {

    public RenderOptions {
        workerCount   = Math.max(0, workerCount);
        maxQueueDepth = Math.max(0, maxQueueDepth);
        outputFormat  = outputFormat != null ? outputFormat : OutputFormat.BGRX;
        rotation      = Math.floorMod(rotation, 4);
        dpi           = Math.max(0, dpi);
    }

    public static RenderOptions defaults() {
        return builder().build();
    }

    public static RenderOptions fromSettings(ParallelRenderSettings settings) {
        return builder()
                .workerCount(settings.getWorkerCount())
                .maxQueueDepth(settings.getMaxQueueDepth())
                .outputFormat(settings.getOutputFormat())
                .dpi(settings.getDpi())
                .keepWorkerCaches(settings.isKeepWorkerCaches())
                .build();
    }
}
