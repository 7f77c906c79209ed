package com.mk.fx.qa.analysis.service.cfg;

import com.mk.fx.qa.analysis.did.DidAnalysisOptions;
import com.mk.fx.qa.analysis.economics.EconomicOptions;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProcessingCfg {

  @Min(1)
  @Max(99)
  private int confidenceLevel = DidAnalysisOptions.DEFAULT_CONFIDENCE_LEVEL;

  @PositiveOrZero private long minimumSampleSize = DidAnalysisOptions.DEFAULT_MINIMUM_SAMPLE_SIZE;

  @DecimalMin(value = "0.0", inclusive = false)
  @DecimalMax(value = "1.0", inclusive = false)
  private double alpha = 0.05;

  @Positive private double annualizationFactor = EconomicOptions.DEFAULT_ANNUALIZATION_FACTOR;

  private boolean includeOnlySignificant = false;

  @Min(1)
  @Max(64)
  private int concurrency = 1;

  @Positive private int historySize = 50;

  @NotBlank private String algorithmVersion = "1.0.0";

  private Results results = new Results();

  public DidAnalysisOptions toDidOptions() {
    return new DidAnalysisOptions(confidenceLevel, minimumSampleSize, alpha);
  }

  public EconomicOptions toEconomicOptions() {
    return new EconomicOptions(annualizationFactor, confidenceLevel, includeOnlySignificant);
  }

  @Data
  public static class Results {

    /** Directory holding one {@code <experimentId>.json} document per experiment. */
    private String directory = "data/experiments";
  }
}
