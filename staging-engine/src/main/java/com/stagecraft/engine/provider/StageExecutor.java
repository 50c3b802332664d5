package com.stagecraft.engine.provider;

import com.stagecraft.engine.model.ImageRef;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Turns (current image, instruction) into exactly one provider job, and
 * reads back job status.
 *
 * Owns size normalization: the input size is fitted to the adapter's
 * {@link SizeConstraints} before the request goes out. Every call is timed
 * and counted:
 * <pre>
 *   stagecraft.provider.calls{provider, operation="submit|poll", status="success|transport|http_status|malformed_response"}
 *   stagecraft.provider.duration{provider, operation}
 * </pre>
 *
 * Failures come back as {@link ProviderException}; nothing is retried here.
 */
@Component
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final MeterRegistry meterRegistry;

    public StageExecutor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws ProviderException if the provider could not accept the job
     */
    public SubmitResult dispatch(ImageProvider provider, ImageRef image, String instruction) {
        GenerationRequest request = buildRequest(provider, image, instruction);
        log.debug("Dispatching to '{}' at {}x{}", provider.name(), request.width(), request.height());
        return instrumented(provider, "submit", () -> provider.submit(request));
    }

    /**
     * @throws ProviderException if the status could not be read
     */
    public JobStatus pollStatus(ImageProvider provider, String jobHandle) {
        return instrumented(provider, "poll", () -> provider.poll(jobHandle));
    }

    GenerationRequest buildRequest(ImageProvider provider, ImageRef image, String instruction) {
        if (!image.hasDimensions()) {
            return new GenerationRequest(image, instruction, null, null, null);
        }
        SizeNormalizer.NormalizedSize size =
                SizeNormalizer.normalize(image.width(), image.height(), provider.sizeConstraints());
        return new GenerationRequest(image, instruction, size.width(), size.height(), size.aspectRatio());
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    private <T> T instrumented(ImageProvider provider, String operation, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return call.get();
        } catch (ProviderException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (Exception e) {
            status = "transport";
            throw new ProviderException(ProviderException.Kind.TRANSPORT,
                    "Unexpected error in provider '" + provider.name() + "' " + operation + ": " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("stagecraft.provider.duration",
                    "provider", provider.name(), "operation", operation));
            meterRegistry.counter("stagecraft.provider.calls",
                    "provider", provider.name(), "operation", operation, "status", status).increment();
        }
    }
}
