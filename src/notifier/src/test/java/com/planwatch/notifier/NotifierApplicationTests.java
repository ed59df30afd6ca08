package com.planwatch.notifier;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.planwatch.notifier.feed.FeedAdapterFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "notifier.push.enabled=false",
      "notifier.poll.enabled=true",
      "notifier.tenants.db-path=target/test-data/bot_config.db",
      "discord.bot-token=test-token"
    })
class NotifierApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @MockBean
  private PipelineCoordinator pipelineCoordinator;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext);
    assertNotNull(applicationContext.getBean("pollFeedAdapterFactory", FeedAdapterFactory.class));
  }
}
