package com.scholary.subsearch.render;

import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Burns text subtitles into the picture with the {@code subtitles} filter. */
@Component
@Order(1)
public class SubtitlesFilterStrategy implements RenderStrategy {

  @Override
  public List<String> buildArguments(RenderRequest request) {
    List<String> args = new ArrayList<>(FfmpegArguments.seekedInput(request));
    String filter =
        "subtitles='" + FfmpegArguments.escapeFilterPath(request.source().toString()) + "'";
    args.addAll(List.of("-filter_complex", filter));
    args.addAll(FfmpegArguments.output(request));
    return args;
  }

  @Override
  public String getStrategyName() {
    return "subtitles-filter";
  }
}
