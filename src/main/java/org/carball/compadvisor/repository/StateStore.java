package org.carball.compadvisor.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.AnalysisRun;
import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.Recommendation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Persists the advisor's runs, recommendations and execution records to a JSON file so separate
 * CLI invocations share history.
 */
@Slf4j
public class StateStore {

    public record Snapshot(
            List<AnalysisRun> runs,
            List<Recommendation> recommendations,
            List<ExecutionRecord> executions
    ) {
        public static Snapshot empty() {
            return new Snapshot(List.of(), List.of(), List.of());
        }
    }

    private final Path file;
    private final ObjectMapper mapper;

    public StateStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    public Snapshot load() throws IOException {
        if (!Files.exists(file)) {
            log.debug("No state file at {}, starting empty", file);
            return Snapshot.empty();
        }
        Snapshot snapshot = mapper.readValue(file.toFile(), Snapshot.class);
        log.debug("Loaded state from {}: {} runs, {} recommendations, {} executions", file,
                sizeOf(snapshot.runs()), sizeOf(snapshot.recommendations()), sizeOf(snapshot.executions()));
        return new Snapshot(orEmpty(snapshot.runs()), orEmpty(snapshot.recommendations()),
                orEmpty(snapshot.executions()));
    }

    /**
     * Loads the file into the given repositories.
     */
    public void loadInto(AnalysisRunRepository runs, RecommendationRepository recommendations,
                         ExecutionRecordRepository executions) throws IOException {
        Snapshot snapshot = load();
        runs.restore(snapshot.runs());
        recommendations.restore(snapshot.recommendations());
        executions.restore(snapshot.executions());
    }

    public void save(AnalysisRunRepository runs, RecommendationRepository recommendations,
                     ExecutionRecordRepository executions) throws IOException {
        Snapshot snapshot = new Snapshot(runs.findAll(), recommendations.findAll(), executions.findAll());
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), snapshot);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Saved state to {}", file);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
