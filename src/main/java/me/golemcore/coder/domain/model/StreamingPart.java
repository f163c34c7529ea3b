package me.golemcore.coder.domain.model;

import java.util.Map;

/**
 * Part whose text arrives as a sequence of deltas.
 */
public interface StreamingPart {

    String getId();

    String getText();

    void setText(String text);

    PartTime getTime();

    void setTime(PartTime time);

    Map<String, Object> getMetadata();

    void setMetadata(Map<String, Object> metadata);
}
