package org.javai.reliability.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.BreakerStatus;
import org.javai.reliability.api.CandidateStats;
import org.javai.reliability.api.TargetKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded file backend that keeps all learning rows in one JSON document.
 *
 * <p>The document is rewritten on every change through a temporary sibling file and an
 * atomic rename, so a crash leaves either the old or the new document on disk. The format
 * is:</p>
 * <pre>{@code
 * {
 *   "version": 1,
 *   "rows": [
 *     {
 *       "screenKey": "vscode:main", "intent": "click_submit", "elementRole": "button",
 *       "candidateId": "css:#submit",
 *       "stats":   { "trials": 3, "rewardSum": 1.0, "misclicks": 1, "timeouts": 0,
 *                    "notFound": 0, "lastSeen": "2026-01-01T00:00:00Z" },
 *       "breaker": { "state": "CLOSED", "openUntil": "1970-01-01T00:00:00Z",
 *                    "emaFail": 0.25, "attempts": 3 }
 *     }
 *   ]
 * }
 * }</pre>
 */
public class JsonFileLearningBackend implements LearningBackend {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileLearningBackend.class);

	/** Current document format version */
	public static final int FORMAT_VERSION = 1;

	private final Path file;
	private final ObjectMapper mapper;
	private final Map<RowKey, LearningRow> snapshot = new LinkedHashMap<>();
	private boolean loaded;

	public JsonFileLearningBackend(Path file) {
		this.file = Objects.requireNonNull(file, "file must not be null");
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
	}

	public Path file() {
		return file;
	}

	@Override
	public synchronized Map<RowKey, LearningRow> loadAll() {
		ensureLoaded();
		return Map.copyOf(snapshot);
	}

	@Override
	public synchronized void save(RowKey key, LearningRow row) {
		ensureLoaded();
		snapshot.put(key, row);
		writeDocument();
	}

	@Override
	public synchronized void deleteTarget(TargetKey target) {
		ensureLoaded();
		if (snapshot.keySet().removeIf(key -> key.target().equals(target))) {
			writeDocument();
		}
	}

	@Override
	public synchronized void deleteAll() {
		ensureLoaded();
		snapshot.clear();
		writeDocument();
	}

	private void ensureLoaded() {
		if (loaded) {
			return;
		}
		if (Files.exists(file)) {
			try {
				byte[] raw = Files.readAllBytes(file);
				if (raw.length > 0) {
					readDocument(mapper.readTree(raw));
				}
			}
			catch (IOException | IllegalArgumentException e) {
				throw new PersistenceException("Failed to read learning file " + file, e);
			}
			logger.info("Loaded {} learning rows from {}", snapshot.size(), file);
		}
		loaded = true;
	}

	private void readDocument(JsonNode root) throws JsonProcessingException {
		int version = root.path("version").asInt(-1);
		if (version != FORMAT_VERSION) {
			throw new PersistenceException(
					"Unsupported learning file version " + version + " in " + file + " (expected " + FORMAT_VERSION + ")");
		}
		for (JsonNode rowNode : root.path("rows")) {
			TargetKey target = new TargetKey(
					rowNode.path("screenKey").asText(),
					rowNode.path("intent").asText(),
					rowNode.path("elementRole").asText());
			RowKey key = new RowKey(target, rowNode.path("candidateId").asText());
			snapshot.put(key, new LearningRow(readStats(rowNode.path("stats")), readBreaker(rowNode.path("breaker"))));
		}
	}

	private CandidateStats readStats(JsonNode node) throws JsonProcessingException {
		return new CandidateStats(
				node.path("trials").asLong(),
				node.path("rewardSum").asDouble(),
				node.path("misclicks").asLong(),
				node.path("timeouts").asLong(),
				node.path("notFound").asLong(),
				readInstant(node.get("lastSeen")));
	}

	private BreakerState readBreaker(JsonNode node) throws JsonProcessingException {
		return new BreakerState(
				BreakerStatus.valueOf(node.path("state").asText(BreakerStatus.CLOSED.name())),
				readInstant(node.get("openUntil")),
				node.path("emaFail").asDouble(),
				node.path("attempts").asLong());
	}

	private Instant readInstant(JsonNode node) throws JsonProcessingException {
		if (node == null || node.isNull()) {
			return Instant.EPOCH;
		}
		return mapper.treeToValue(node, Instant.class);
	}

	private void writeDocument() {
		ObjectNode root = mapper.createObjectNode();
		root.put("version", FORMAT_VERSION);
		ArrayNode rowsNode = root.putArray("rows");
		snapshot.forEach((key, row) -> rowsNode.add(rowToJson(key, row)));

		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path temp = file.resolveSibling(file.getFileName() + ".tmp");
			Files.write(temp, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
			try {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e) {
			throw new PersistenceException("Failed to write learning file " + file, e);
		}
	}

	private ObjectNode rowToJson(RowKey key, LearningRow row) {
		ObjectNode node = mapper.createObjectNode();
		node.put("screenKey", key.target().screenKey());
		node.put("intent", key.target().intent());
		node.put("elementRole", key.target().elementRole());
		node.put("candidateId", key.candidateId());

		CandidateStats stats = row.stats();
		ObjectNode statsNode = node.putObject("stats");
		statsNode.put("trials", stats.trials());
		statsNode.put("rewardSum", stats.rewardSum());
		statsNode.put("misclicks", stats.misclicks());
		statsNode.put("timeouts", stats.timeouts());
		statsNode.put("notFound", stats.notFound());
		statsNode.set("lastSeen", mapper.valueToTree(stats.lastSeen()));

		BreakerState breaker = row.breaker();
		ObjectNode breakerNode = node.putObject("breaker");
		breakerNode.put("state", breaker.status().name());
		breakerNode.set("openUntil", mapper.valueToTree(breaker.openUntil()));
		breakerNode.put("emaFail", breaker.emaFail());
		breakerNode.put("attempts", breaker.attempts());
		return node;
	}
}
