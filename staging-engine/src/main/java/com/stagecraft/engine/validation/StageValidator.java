package com.stagecraft.engine.validation;

import com.stagecraft.engine.model.ImageRef;
import com.stagecraft.engine.model.StageConfig;
import com.stagecraft.engine.model.ViolationTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Judges one stage output against the stage's domain rules.
 *
 * Every {@link ValidationCheck} bean is collected at startup; a check runs
 * when it {@link ValidationCheck#appliesTo applies to} the stage kind.
 * Violations are reported in check-name order so the result is stable.
 *
 * The validator never decides what happens next; it only returns a verdict.
 */
@Component
public class StageValidator {

    private static final Logger log = LoggerFactory.getLogger(StageValidator.class);

    private final List<ValidationCheck> checks;
    private final ImageLoader           imageLoader;

    public StageValidator(List<ValidationCheck> checks, ImageLoader imageLoader) {
        this.checks = checks.stream()
                .sorted(Comparator.comparing(ValidationCheck::name))
                .toList();
        this.imageLoader = imageLoader;
        log.info("Stage validator checks: {}", this.checks.stream().map(ValidationCheck::name).toList());
    }

    /**
     * @throws ImageLoadException if either image cannot be fetched or decoded
     */
    public ValidationVerdict validate(ImageRef before, ImageRef after, StageConfig stage) {
        ImageSample beforeSample = ImageSample.of(imageLoader.load(before));
        ImageSample afterSample  = ImageSample.of(imageLoader.load(after));
        return validate(beforeSample, afterSample, stage);
    }

    public ValidationVerdict validate(ImageSample before, ImageSample after, StageConfig stage) {
        ValidationContext ctx = ValidationContext.of(before, after, stage);
        List<ViolationTag> violations = new ArrayList<>();
        for (ValidationCheck check : checks) {
            if (!check.appliesTo(stage.stageKind())) continue;
            check.evaluate(ctx).ifPresent(tag -> {
                if (!violations.contains(tag)) violations.add(tag);
            });
        }
        ValidationVerdict verdict = ValidationVerdict.of(ctx.itemCountEstimate(), violations);
        log.debug("{} verdict: passed={} items~{} violations={}",
                stage.stageKind(), verdict.passed(), verdict.itemCountEstimate(), violations);
        return verdict;
    }
}
