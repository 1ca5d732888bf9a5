package org.javai.reliability.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.javai.reliability.api.BreakerStatus;
import org.javai.reliability.api.CandidateStats;
import org.javai.reliability.api.OutcomeKind;
import org.javai.reliability.api.TargetKey;
import org.javai.reliability.testsupport.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileLearningBackendTest {

	private static final TargetKey TARGET = TargetKey.of("chrome:checkout", "click_pay", "button");
	private static final TargetKey OTHER = TargetKey.of("chrome:checkout", "fill_email", "textbox");

	@TempDir
	Path tempDir;

	private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");

	private LearningStore open(Path file) {
		return new LearningStore(new JsonFileLearningBackend(file), EmaBreakerPolicy.defaults(), clock, 1,
				Duration.ZERO);
	}

	@Test
	void missingFileStartsEmpty() {
		JsonFileLearningBackend backend = new JsonFileLearningBackend(tempDir.resolve("learning.json"));

		assertThat(backend.loadAll()).isEmpty();
		assertThat(backend.file()).doesNotExist();
	}

	@Test
	void learningSurvivesRestart() {
		Path file = tempDir.resolve("state/learning.json");
		LearningStore first = open(file);
		first.recordOutcome(TARGET, "css:#pay", OutcomeKind.SUCCESS);
		first.recordOutcome(TARGET, "css:#pay", OutcomeKind.NOT_FOUND);
		for (int i = 0; i < 5; i++) {
			first.recordOutcome(TARGET, "uia:Pay", OutcomeKind.MISCLICK);
		}

		LearningStore second = open(file);

		CandidateStats stats = second.getStats(TARGET, "css:#pay").orElseThrow();
		assertThat(stats.trials()).isEqualTo(2);
		assertThat(stats.notFound()).isEqualTo(1);
		assertThat(stats.rewardSum()).isEqualTo(first.getStats(TARGET, "css:#pay").orElseThrow().rewardSum());
		assertThat(stats.lastSeen()).isEqualTo(clock.instant());
		assertThat(second.isOpen(TARGET, "uia:Pay")).isTrue();
		assertThat(second.getBreaker(TARGET, "uia:Pay").orElseThrow().openUntil())
				.isEqualTo(clock.instant().plusSeconds(30));
	}

	@Test
	void documentCarriesVersionAndIsoDates() throws IOException {
		Path file = tempDir.resolve("learning.json");
		open(file).recordOutcome(TARGET, "css:#pay", OutcomeKind.TIMEOUT);

		String json = Files.readString(file, StandardCharsets.UTF_8);

		assertThat(json)
				.contains("\"version\" : 1")
				.contains("\"candidateId\" : \"css:#pay\"")
				.contains("\"lastSeen\" : \"2026-03-01T10:00:00Z\"")
				.contains("\"state\" : \"CLOSED\"");
		assertThat(tempDir.resolve("learning.json.tmp")).doesNotExist();
	}

	@Test
	void deleteTargetRemovesOnlyItsRows() {
		Path file = tempDir.resolve("learning.json");
		LearningStore store = open(file);
		store.recordOutcome(TARGET, "css:#pay", OutcomeKind.SUCCESS);
		store.recordOutcome(OTHER, "css:#email", OutcomeKind.SUCCESS);

		store.resetTarget(TARGET);

		JsonFileLearningBackend reread = new JsonFileLearningBackend(file);
		assertThat(reread.loadAll()).containsOnlyKeys(new RowKey(OTHER, "css:#email"));
	}

	@Test
	void corruptFileFailsToLoad() throws IOException {
		Path file = tempDir.resolve("learning.json");
		Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

		assertThatThrownBy(() -> new JsonFileLearningBackend(file).loadAll())
				.isInstanceOf(PersistenceException.class)
				.hasMessageContaining("Failed to read learning file");
	}

	@Test
	void invalidRowFailsToLoad() throws IOException {
		Path file = tempDir.resolve("learning.json");
		Files.writeString(file, """
				{ "version": 1, "rows": [ { "screenKey": "", "intent": "x", "elementRole": "y", "candidateId": "z" } ] }
				""", StandardCharsets.UTF_8);

		assertThatThrownBy(() -> new JsonFileLearningBackend(file).loadAll())
				.isInstanceOf(PersistenceException.class);
	}

	@Test
	void unsupportedVersionFailsToLoad() throws IOException {
		Path file = tempDir.resolve("learning.json");
		Files.writeString(file, "{ \"version\": 2, \"rows\": [] }", StandardCharsets.UTF_8);

		assertThatThrownBy(() -> open(file))
				.isInstanceOf(PersistenceException.class)
				.hasMessageContaining("Unsupported learning file version 2");
	}

	@Test
	void unwritableLocationDegradesStoreInsteadOfFailing() throws IOException {
		Path blocker = Files.createFile(tempDir.resolve("blocker"));
		LearningStore store = open(blocker.resolve("learning.json"));

		store.recordOutcome(TARGET, "css:#pay", OutcomeKind.SUCCESS);

		assertThat(store.persistenceStatus()).isEqualTo(PersistenceStatus.DEGRADED_PERSISTENCE);
		assertThat(store.getStats(TARGET, "css:#pay")).isPresent();
		assertThat(store.getBreaker(TARGET, "css:#pay").orElseThrow().status()).isEqualTo(BreakerStatus.CLOSED);
	}
}
