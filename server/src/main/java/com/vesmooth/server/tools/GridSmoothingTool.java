package com.vesmooth.server.tools;

import com.vesmooth.server.grid.Grid;
import com.vesmooth.server.grid.InvalidGridException;
import com.vesmooth.server.grid.pipeline.GridMetrics;
import com.vesmooth.server.grid.pipeline.PipelineConfigLoader;
import com.vesmooth.server.grid.pipeline.PipelineResult;
import com.vesmooth.server.grid.pipeline.PipelineStage;
import com.vesmooth.server.grid.pipeline.SmoothingPipeline;
import com.vesmooth.server.util.GridCsv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline tool that smooths a CSV table and writes one CSV per stage.
 * Usage: GridSmoothingTool <inputCsv> <outputDir> [gradientThreshold] [smoothingPasses]
 * Parameters not given on the command line come from smoothing_config.json.
 */
public class GridSmoothingTool {

    private static final Logger logger = LoggerFactory.getLogger(GridSmoothingTool.class);

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: GridSmoothingTool <inputCsv> <outputDir> [gradientThreshold] [smoothingPasses]");
            System.exit(1);
        }

        try {
            PipelineConfigLoader.ConfigRoot config = PipelineConfigLoader.loadDefault();
            double threshold = args.length > 2 ? Double.parseDouble(args[2]) : config.gradientThresholdOrDefault();
            int passes = args.length > 3 ? Integer.parseInt(args[3]) : config.smoothingPassesOrDefault();

            List<Path> written = run(Paths.get(args[0]), Paths.get(args[1]), new SmoothingPipeline(passes, threshold));
            logger.info("Wrote {} stage files to {}", written.size(), args[1]);
        } catch (InvalidGridException | NumberFormatException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.exit(2);
        } catch (IOException e) {
            logger.error("Smoothing failed", e);
            System.exit(1);
        }
    }

    /**
     * Reads the input table, runs the pipeline and writes
     * {@code stage_<index>_<id>.csv} for every snapshot.
     */
    public static List<Path> run(Path inputCsv, Path outputDir, SmoothingPipeline pipeline) throws IOException {
        double[][] values;
        try (Reader in = Files.newBufferedReader(inputCsv, StandardCharsets.UTF_8)) {
            values = GridCsv.read(in);
        }
        logger.info("Loaded {}x{} table from {}", values.length, values.length > 0 ? values[0].length : 0, inputCsv);

        PipelineResult result = pipeline.run(values);
        Grid raw = result.getRaw();

        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        for (PipelineStage stage : PipelineStage.values()) {
            Grid g = result.getStage(stage);
            Path out = outputDir.resolve(String.format("stage_%d_%s.csv", stage.index(), stage.getId()));
            try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
                GridCsv.write(g, w);
            }
            written.add(out);
            logger.info("Stage {} ({}): {}", stage.index(), stage.getTitle(), GridMetrics.summarize(g, raw));
        }
        return written;
    }
}
