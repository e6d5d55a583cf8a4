package com.wxplot.plotapi.series.repository;

import com.wxplot.plotapi.config.PlotProperties;
import com.wxplot.plotapi.series.model.DataBinding;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DataBindingRegistry {
  private static final Logger log = LoggerFactory.getLogger(DataBindingRegistry.class);

  private final Map<String, DataBinding> bindings;

  public DataBindingRegistry(PlotProperties properties) {
    Map<String, DataBinding> resolved = new LinkedHashMap<>();
    properties.bindings().forEach((name, binding) -> resolved.put(name,
        new DataBinding(name, binding.table(), binding.observations(),
            binding.recordIntervalUnit())));
    this.bindings = Collections.unmodifiableMap(resolved);
    log.info("Configured {} data binding(s): {}", bindings.size(), bindings.keySet());
  }

  public DataBinding get(String name) {
    DataBinding binding = bindings.get(name);
    if (binding == null) {
      throw new NoSuchElementException("Data binding not found: " + name);
    }
    return binding;
  }

  public DataBinding observation(String bindingName, String observationType) {
    DataBinding binding = get(bindingName);
    if (!binding.allows(observationType)) {
      throw new NoSuchElementException(
          "Observation " + observationType + " not found in binding " + bindingName);
    }
    return binding;
  }
}
