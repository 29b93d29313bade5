package com.scholary.subsearch.render;

import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Overlays the first subtitle stream onto the video, for bitmap subtitle tracks. */
@Component
@Order(2)
public class SubtitleOverlayStrategy implements RenderStrategy {

  @Override
  public List<String> buildArguments(RenderRequest request) {
    List<String> args = new ArrayList<>(FfmpegArguments.seekedInput(request));
    args.addAll(List.of("-filter_complex", "[0:v][0:s]overlay[v]", "-map", "[v]"));
    if (request.kind() == RenderRequest.Kind.CLIP) {
      args.addAll(List.of("-map", "0:a?"));
    }
    args.addAll(FfmpegArguments.output(request));
    return args;
  }

  @Override
  public String getStrategyName() {
    return "subtitle-overlay";
  }
}
