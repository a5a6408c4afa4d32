package com.mysteryhub.gameservice.games.mystery.application;

import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecord;
import com.mysteryhub.gameservice.games.mystery.domain.dto.SessionRecordConverter;
import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.domain.repository.SessionArchiveRepository;
import com.mysteryhub.gameservice.games.mystery.service.SessionEventListener;
import com.mysteryhub.gameservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 提交后归档
 * ----------------------------------------
 * 在互斥区内把会话拷贝为 SessionRecord（纯内存），再交给归档线程写 Redis。
 * 写失败只记 WARN：内存中的会话才是权威状态。
 * 已关闭的会话不再写入，删除任务与保存任务共用单线程执行器，按提交顺序执行。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "mysteryhub.archive", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionArchiver implements SessionEventListener {

    private final SessionArchiveRepository archiveRepository;
    private final Executor archiveExecutor;
    private final Duration ttl;

    public SessionArchiver(SessionArchiveRepository archiveRepository,
                           @Qualifier("archiveExecutor") Executor archiveExecutor,
                           @Value("${mysteryhub.archive.ttl:PT6H}") Duration ttl) {
        this.archiveRepository = archiveRepository;
        this.archiveExecutor = archiveExecutor;
        this.ttl = ttl;
    }

    @Override
    public void afterCommit(GameSession session, List<Envelope<?>> events) {
        if (session.isClosed()) {
            return;
        }
        SessionRecord record = SessionRecordConverter.toRecord(session);
        submit(record.getId(), () -> archiveRepository.save(record, ttl));
    }

    @Override
    public void onSessionEvicted(String sessionId, String reason) {
        submit(sessionId, () -> archiveRepository.delete(sessionId));
    }

    private void submit(String sessionId, Runnable task) {
        try {
            archiveExecutor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("会话归档失败: sessionId={}", sessionId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("归档任务被拒绝: sessionId={}", sessionId, e);
        }
    }
}
