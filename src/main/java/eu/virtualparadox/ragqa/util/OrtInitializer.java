package eu.virtualparadox.ragqa.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options for CPU inference.
     * <p>
     * Parallelism across requests comes from the embedding worker pool, so each session
     * runs a single inter-op thread.
     *
     * @param intraOpThreads threads used inside one operator, at least 1
     */
    public static OrtSession.SessionOptions initializeOrt(final int intraOpThreads) {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            final int intraThreads = Math.max(1, intraOpThreads);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        }
        catch (OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
