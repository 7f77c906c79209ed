package com.mk.fx.qa.analysis.service.cfg;

import com.mk.fx.qa.analysis.AnalysisPipeline;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineCfg {

  @Bean
  public AnalysisPipeline analysisPipeline() {
    return new AnalysisPipeline();
  }

  @Bean
  public Clock analysisClock() {
    return Clock.systemUTC();
  }
}
