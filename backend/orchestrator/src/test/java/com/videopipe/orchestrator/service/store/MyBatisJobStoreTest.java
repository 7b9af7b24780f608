package com.videopipe.orchestrator.service.store;

import com.videopipe.common.enums.FailureKind;
import com.videopipe.common.enums.PipelineStatus;
import com.videopipe.common.enums.SceneStage;
import com.videopipe.common.enums.StageOutcome;
import com.videopipe.common.enums.StageType;
import com.videopipe.orchestrator.entity.PipelineJob;
import com.videopipe.orchestrator.entity.SceneJob;
import com.videopipe.orchestrator.entity.StageCallRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * MyBatisJobStore 통합 테스트 (H2 MySQL 모드, schema.sql)
 * 저장소가 REQUIRES_NEW 로 커밋하므로 테스트 트랜잭션 없이 실행하고 작업 ID 는 매번 새로 만든다.
 */
@MybatisTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:jobstore;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
        "spring.sql.init.mode=always"
})
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(MyBatisJobStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MyBatisJobStoreTest {

    @Autowired
    private MyBatisJobStore store;

    private final LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);

    private PipelineJob newJob(String jobId, List<String> sceneJobIds) {
        return PipelineJob.builder()
                .jobId(jobId)
                .scriptRef("scripts/lighthouse.md")
                .scriptTitle("The Lighthouse")
                .status(PipelineStatus.QUEUED)
                .costAccumulated(BigDecimal.ZERO)
                .costBudget(new BigDecimal("2.5000"))
                .sceneJobIds(new ArrayList<>(sceneJobIds))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private SceneJob newScene(String jobId, String sceneJobId, int index) {
        SceneJob scene = SceneJob.builder()
                .sceneJobId(sceneJobId)
                .pipelineJobId(jobId)
                .sceneIndex(index)
                .currentStage(SceneStage.SCRIPT)
                .createdAt(now)
                .updatedAt(now)
                .build();
        scene.getInputs().put(SceneJob.INPUT_SCENE_TEXT, "Waves crash against the \"old\" tower.");
        return scene;
    }

    @Test
    @DisplayName("작업과 씬을 저장하고 JSON 컬럼까지 그대로 읽어온다")
    void savesAndLoadsSnapshot() {
        // given
        String jobId = UUID.randomUUID().toString();
        String s0 = jobId + "-0";
        String s1 = jobId + "-1";
        PipelineJob job = newJob(jobId, List.of(s0, s1));
        job.getStageAttempts().put(StageType.ASSEMBLY, 2);
        SceneJob first = newScene(jobId, s0, 0);
        first.getAttempts().put(StageType.VOICE, 3);
        first.getFallbackUsed().add(StageType.VISUAL);
        first.getAssets().put(StageType.VOICE, "sim://assets/voice.mp3");

        // when
        store.save(job, List.of(newScene(jobId, s1, 1), first));
        JobSnapshot snapshot = store.load(jobId).orElseThrow();

        // then
        PipelineJob loaded = snapshot.pipelineJob();
        assertThat(loaded.getStatus()).isEqualTo(PipelineStatus.QUEUED);
        assertThat(loaded.getSceneJobIds()).containsExactly(s0, s1);
        assertThat(loaded.attemptsOf(StageType.ASSEMBLY)).isEqualTo(2);
        assertThat(loaded.getCostBudget()).isEqualByComparingTo("2.5");

        assertThat(snapshot.sceneJobs()).extracting(SceneJob::getSceneIndex).containsExactly(0, 1);
        SceneJob loadedScene = snapshot.sceneJobs().get(0);
        assertThat(loadedScene.attemptsOf(StageType.VOICE)).isEqualTo(3);
        assertThat(loadedScene.getFallbackUsed()).containsExactly(StageType.VISUAL);
        assertThat(loadedScene.getAssets()).containsEntry(StageType.VOICE, "sim://assets/voice.mp3");
        assertThat(loadedScene.input(SceneJob.INPUT_SCENE_TEXT)).isEqualTo("Waves crash against the \"old\" tower.");
    }

    @Test
    @DisplayName("같은 ID 로 다시 저장하면 갱신된다")
    void updatesExistingRows() {
        // given
        String jobId = UUID.randomUUID().toString();
        String sceneJobId = jobId + "-0";
        PipelineJob job = newJob(jobId, List.of(sceneJobId));
        SceneJob scene = newScene(jobId, sceneJobId, 0);
        store.save(job, List.of(scene));

        // when
        job.setStatus(PipelineStatus.FAILED);
        job.setLastError("Scene 0 failed");
        job.setLastErrorKind(FailureKind.SCENE_FAILED);
        job.addCost(new BigDecimal("0.0300"));
        job.setInFlightStage(StageType.ASSEMBLY);
        store.savePipelineJob(job);
        scene.setCurrentStage(SceneStage.FAILED);
        scene.setFailedStage(StageType.VISUAL);
        scene.setLastErrorKind(FailureKind.MODERATION_REJECTED);
        store.saveSceneJob(scene);

        // then
        PipelineJob loadedJob = store.load(jobId).orElseThrow().pipelineJob();
        assertThat(loadedJob.getStatus()).isEqualTo(PipelineStatus.FAILED);
        assertThat(loadedJob.getLastErrorKind()).isEqualTo(FailureKind.SCENE_FAILED);
        assertThat(loadedJob.getCostAccumulated()).isEqualByComparingTo("0.03");
        assertThat(loadedJob.getInFlightStage()).isEqualTo(StageType.ASSEMBLY);

        SceneJob loadedScene = store.findSceneJob(sceneJobId).orElseThrow();
        assertThat(loadedScene.getCurrentStage()).isEqualTo(SceneStage.FAILED);
        assertThat(loadedScene.getFailedStage()).isEqualTo(StageType.VISUAL);
        assertThat(loadedScene.getLastErrorKind()).isEqualTo(FailureKind.MODERATION_REJECTED);
    }

    @Test
    @DisplayName("멱등 키로 작업 ID 를 찾는다")
    void findsByIdempotencyKey() {
        String jobId = UUID.randomUUID().toString();
        String key = "key-" + jobId;
        PipelineJob job = newJob(jobId, List.of());
        job.setIdempotencyKey(key);
        store.savePipelineJob(job);

        assertThat(store.findJobIdByIdempotencyKey(key)).contains(jobId);
        assertThat(store.findJobIdByIdempotencyKey("missing-" + jobId)).isEmpty();
    }

    @Test
    @DisplayName("복구 대상에는 진행 중 작업만 포함된다")
    void findsRecoverableJobs() {
        String running = UUID.randomUUID().toString();
        String completed = UUID.randomUUID().toString();
        PipelineJob runningJob = newJob(running, List.of());
        runningJob.setStatus(PipelineStatus.RUNNING);
        PipelineJob completedJob = newJob(completed, List.of());
        completedJob.setStatus(PipelineStatus.COMPLETED);
        store.savePipelineJob(runningJob);
        store.savePipelineJob(completedJob);

        assertThat(store.findRecoverableJobIds()).contains(running).doesNotContain(completed);
    }

    @Test
    @DisplayName("감사 기록은 추가 순서대로 조회되고 ID 가 발급된다")
    void appendsAuditRecords() {
        // given
        String jobId = UUID.randomUUID().toString();
        store.savePipelineJob(newJob(jobId, List.of()));

        // when
        store.appendAuditRecord(StageCallRecord.builder()
                .pipelineJobId(jobId).sceneJobId(jobId + "-0").stage(StageType.VISUAL).attempt(1)
                .outcome(StageOutcome.MODERATION_REJECTED).startedAt(now).endedAt(now)
                .providerLatencyMs(120L).errorMessage("blocked").build());
        store.appendAuditRecord(StageCallRecord.builder()
                .pipelineJobId(jobId).stage(StageType.ASSEMBLY).attempt(1)
                .outcome(StageOutcome.SUCCESS).startedAt(now).endedAt(now)
                .costDelta(new BigDecimal("0.0100")).build());

        // then
        List<StageCallRecord> records = store.findAuditRecords(jobId);
        assertThat(records)
                .extracting(StageCallRecord::getStage, StageCallRecord::getOutcome)
                .containsExactly(
                        tuple(StageType.VISUAL, StageOutcome.MODERATION_REJECTED),
                        tuple(StageType.ASSEMBLY, StageOutcome.SUCCESS));
        assertThat(records.get(0).getRecordId()).isNotNull();
        assertThat(records.get(1).getSceneJobId()).isNull();
    }
}
