package chaptercrawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

public class OutputManager {
    private static final Logger log = LoggerFactory.getLogger(OutputManager.class);

    // The combined document; failures go next to it as <name>.failures.csv
    private final Path outputPath;

    private final FailureLogger failureLogger;

    public OutputManager(Path outputPath, FailureLogger failureLogger) {
        this.outputPath = outputPath;
        this.failureLogger = failureLogger;
    }

    // Write the assembled document. Any IOException is fatal for the run and is passed on.
    public Path writeDocument(String html) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, html == null ? "" : html, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return outputPath;
    }

    public Path failuresPath() {
        return outputPath.resolveSibling(outputPath.getFileName() + ".failures.csv");
    }

    // Returns the file written, or null when there was nothing to write or writing failed.
    public Path writeFailuresFile() {
        if (failureLogger.isEmpty()) return null;

        Path out = failuresPath();
        try {
            // Very simple CSV: index,url,type,message
            List<String> lines = new ArrayList<>();
            lines.add("index,url,type,message");

            for (FailureRecord f : failureLogger.snapshot()) {
                lines.add(csv(f.index()) + "," + csv(f.url()) + "," + csv(f.type()) + "," + csv(f.message()));
            }

            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return out;
        } catch (IOException e) {
            log.warn("Could not write failures file {}: {}", out, e.getMessage());
            return null;
        }
    }

    // Quote CSV fields safely (minimal)
    static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
