package io.tasklint.core.validation;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.tasklint.core.model.Step;
import io.tasklint.core.model.TaskSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Verifies the DEBUG trail the validator leaves for accepted and rejected tasks. */
@DisplayName("TaskValidator logging")
class TaskValidatorLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger validatorLogger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        validatorLogger = (Logger) LoggerFactory.getLogger(TaskValidator.class);
        previousLevel = validatorLogger.getLevel();
        validatorLogger.setLevel(Level.DEBUG);
        logAppender = new ListAppender<>();
        logAppender.start();
        validatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        validatorLogger.detachAppender(logAppender);
        logAppender.stop();
        validatorLogger.setLevel(previousLevel);
    }

    @Test
    void rejectionLogsStageAndPaths() {
        new TaskValidator().validate(TaskSpec.builder().addStep(Step.builder().name("s").build()).build());

        assertThat(logAppender.list).hasSize(1);
        ILoggingEvent event = logAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(event.getFormattedMessage())
                .contains("rejected at STRUCTURE")
                .contains("missing field(s)")
                .contains("steps.Image");
    }

    @Test
    void acceptanceLogsStepCount() {
        new TaskValidator()
                .validate(TaskSpec.builder()
                        .addStep(Step.builder().name("s").image("busybox").build())
                        .build());

        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Task 'null' is valid (1 steps)");
    }
}
