package com.scholary.subsearch.render;

import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Renders the picture without subtitles. */
@Component
@Order(3)
public class PlainVideoStrategy implements RenderStrategy {

  @Override
  public List<String> buildArguments(RenderRequest request) {
    List<String> args = new ArrayList<>(FfmpegArguments.seekedInput(request));
    args.addAll(FfmpegArguments.output(request));
    return args;
  }

  @Override
  public String getStrategyName() {
    return "plain-video";
  }
}
