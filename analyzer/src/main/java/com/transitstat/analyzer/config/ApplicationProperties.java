package com.transitstat.analyzer.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.transitstat.analyzer.dto.report.OutputNaming;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "analyzer")
public class ApplicationProperties {

  private String logRoot;

  /** Target month 1..12. When unset the previous calendar month is analyzed. */
  private Integer month;

  private String serverName = "fukuoka";
  private String serverType = "sp";
  private String outputDir = "./";
  private boolean collectInvalid;
  private OutputNaming outputNaming = OutputNaming.MONTH;
  private String profileResource = "/reference/log-profiles.json";
  private boolean runOnStartup = true;

  private List<String> allowedServerNames = new ArrayList<>(Arrays.asList("fukuoka", "zentanbus"));
  private List<String> allowedServerTypes = new ArrayList<>(Arrays.asList("pc", "sp"));

  private Diagnostics diagnostics = new Diagnostics();
  private Cache cache = new Cache();

  @Data
  public static class Diagnostics {
    private String unusualFileName = "unusual.txt";
    private String invalidFileName = "invalid.txt";
  }

  @Data
  public static class Cache {
    private boolean enabled = true;
    private long maxSize = 10000;
    private long expireAfterWriteMinutes = 60;
  }
}
