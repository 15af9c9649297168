package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.notification.channel.ChannelSenderRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class NotificationConfigurationTest {

    private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(NotificationConfiguration.class)
            .withBean(NotificationDispatcher.class, () -> dispatcher);

    @Test
    void schedulerPollsWithConfiguredBatchSize() {
        runner.withPropertyValues(
                        "saga.notification.dispatcher.initial-delay=0ms",
                        "saga.notification.dispatcher.poll-interval=50ms",
                        "saga.notification.dispatcher.batch-size=7")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(NotificationScheduler.class);
                    assertThat(ctx.getBean(ChannelSenderRegistry.class).forChannel(NotificationChannel.SMS).channel())
                            .isEqualTo(NotificationChannel.SMS);

                    await().atMost(Duration.ofSeconds(5))
                            .untilAsserted(() -> verify(dispatcher, atLeast(2)).processBatch(7, 0));
                });
    }

    @Test
    void disabledDispatcherRegistersNoScheduler() {
        runner.withPropertyValues("saga.notification.dispatcher.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(NotificationScheduler.class);
                    assertThat(ctx).hasBean("notificationSchedule");
                });
        verify(dispatcher, never()).processBatch(anyInt(), anyInt());
    }
}
