package com.example.roundtable.controller;

import com.example.roundtable.config.FeaturesProperties;
import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.topic.TopicService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Client-facing settings, so the UI can show turn length and limits. */
@RestController
public class ConfigController {

  private final RoundtableProperties props;
  private final FeaturesProperties features;
  private final TopicService topics;

  public ConfigController(RoundtableProperties props, FeaturesProperties features, TopicService topics) {
    this.props = props;
    this.features = features;
    this.topics = topics;
  }

  @GetMapping("/api/config")
  public Map<String, Object> config() {
    Map<String, Object> f = new LinkedHashMap<>();
    f.put("aiTopics", topics.isAiEnabled());
    f.put("analytics", features.analytics().enabled());

    Map<String, Object> m = new LinkedHashMap<>();
    m.put("minParticipants", props.minParticipants());
    m.put("maxSpeakers", props.maxSpeakers());
    m.put("turnDurationSeconds", props.turnDurationSeconds());
    m.put("maxRounds", props.maxRounds());
    m.put("advancePolicy", props.advancePolicy().name());
    m.put("features", f);
    return m;
  }
}
