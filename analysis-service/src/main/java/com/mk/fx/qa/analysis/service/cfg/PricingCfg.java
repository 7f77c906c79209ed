package com.mk.fx.qa.analysis.service.cfg;

import com.mk.fx.qa.analysis.service.model.MetricValue;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Dollar value per unit for each metric, keyed by metric id. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "analysis.pricing")
public class PricingCfg {

  @Valid private Map<String, MetricValue> metrics = new LinkedHashMap<>();
}
