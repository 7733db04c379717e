package org.kryon.kirgen.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Window metadata of an App module ({@code "app"} section of the KIR).
 */
public class AppWindow {
    @JsonProperty("windowTitle")
    @JsonAlias("window_title")
    public String windowTitle;

    @JsonProperty("windowWidth")
    @JsonAlias("window_width")
    public Integer windowWidth;

    @JsonProperty("windowHeight")
    @JsonAlias("window_height")
    public Integer windowHeight;

    public boolean hasMetadata() {
        return windowTitle != null || windowWidth != null || windowHeight != null;
    }
}
