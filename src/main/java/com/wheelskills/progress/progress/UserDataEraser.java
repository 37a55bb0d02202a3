package com.wheelskills.progress.progress;

import com.wheelskills.progress.domain.TrainingPhase;
import com.wheelskills.progress.repository.EventLogJdbcRepository;
import com.wheelskills.progress.repository.UserJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Irreversibly removes everything a user has recorded. The user record itself stays,
 * reset to the first training phase.
 */
@Service
public class UserDataEraser {
    private static final Logger log = LoggerFactory.getLogger(UserDataEraser.class);

    private final UserService userService;
    private final UserJdbcRepository users;
    private final EventLogJdbcRepository eventLog;

    public UserDataEraser(UserService userService, UserJdbcRepository users, EventLogJdbcRepository eventLog) {
        this.userService = userService;
        this.users = users;
        this.eventLog = eventLog;
    }

    @Transactional
    public void clearProgress(String userId) {
        userService.requireUser(userId);
        int attempts = eventLog.deleteByUser(userId);
        users.deleteSkillProgress(userId);
        users.deleteSessions(userId);
        users.updatePhase(userId, TrainingPhase.FOUNDATION, Instant.now());
        log.info("Cleared progress of user {} ({} attempts removed)", userId, attempts);
    }
}
