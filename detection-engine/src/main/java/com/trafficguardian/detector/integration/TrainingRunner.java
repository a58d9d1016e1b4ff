package com.trafficguardian.detector.integration;

import com.trafficguardian.detector.detection.DetectorStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Trains the ensemble at startup when launched with
 * {@code --train=<file> [--adapter=<type>] [--contamination=<share>] [--limit=<n>]}.
 *
 * @author Naveed Gung
 */
@Component
public class TrainingRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TrainingRunner.class);

    private final DetectionService detectionService;

    public TrainingRunner(DetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        String file = option(args, "train");
        if (file == null) {
            return;
        }
        String adapter = option(args, "adapter");
        String contamination = option(args, "contamination");
        String limit = option(args, "limit");

        log.info("Training models from {} (adapter={}, contamination={}, limit={})",
                file, adapter, contamination, limit);
        DetectorStatus status = detectionService.trainFromFile(
                Path.of(file),
                adapter,
                contamination != null ? Double.valueOf(contamination) : null,
                limit != null ? Integer.valueOf(limit) : null);
        log.info("Training complete: model version {} with {} features from {} samples",
                status.version(), status.featureCount(), status.samples());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
