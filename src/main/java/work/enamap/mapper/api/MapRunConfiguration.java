package work.enamap.mapper.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.enamap.mapper.config.ToolSettings;

/**
 * Immutable configuration for one map request run.
 */
public record MapRunConfiguration(
    Path requestFile,
    ToolSettings settings,
    Optional<Path> outputDirectory,
    Path workingDirectory
) {
    public MapRunConfiguration {
        Objects.requireNonNull(requestFile, "requestFile");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path requestFile;
        private ToolSettings settings;
        private Optional<Path> outputDirectory = Optional.empty();
        private Path workingDirectory = Path.of("").toAbsolutePath();

        public Builder requestFile(Path requestFile) {
            this.requestFile = requestFile;
            return this;
        }

        public Builder settings(ToolSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder outputDirectory(Optional<Path> outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public MapRunConfiguration build() {
            return new MapRunConfiguration(requestFile, settings, outputDirectory, workingDirectory);
        }
    }
}
