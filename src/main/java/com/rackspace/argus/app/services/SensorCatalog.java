package com.rackspace.argus.app.services;

import com.rackspace.argus.app.config.AppProperties;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Tag to component catalog taken from <code>argus.catalog.tags</code>.
 */
@Component
public class SensorCatalog {

  private final Map<String, String> tagToComponent;

  @Autowired
  public SensorCatalog(AppProperties appProperties) {
    this.tagToComponent = Map.copyOf(appProperties.getCatalog().getTags());
  }

  public Map<String, String> getTagToComponent() {
    return tagToComponent;
  }
}
