package com.teamchat.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class FlywayAutoRepairConfigTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(FlywayAutoRepairConfig.class);

    @Test
    void strategyIsRegisteredUnlessTurnedOff() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(FlywayMigrationStrategy.class));
        contextRunner
                .withPropertyValues("chat.flyway.auto-repair=false")
                .run(context -> assertThat(context).doesNotHaveBean(FlywayMigrationStrategy.class));
    }

    @Test
    void cleanValidation_MigratesWithoutRepair() {
        Flyway flyway = mock(Flyway.class);

        new FlywayAutoRepairConfig().flywayMigrationStrategy().migrate(flyway);

        verify(flyway).migrate();
        verify(flyway, never()).repair();
    }

    @Test
    void failedValidation_RepairsThenMigrates() {
        Flyway flyway = mock(Flyway.class);
        doThrow(mock(FlywayValidateException.class)).when(flyway).validate();

        new FlywayAutoRepairConfig().flywayMigrationStrategy().migrate(flyway);

        InOrder order = inOrder(flyway);
        order.verify(flyway).validate();
        order.verify(flyway).repair();
        order.verify(flyway).migrate();
    }
}
