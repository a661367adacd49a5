package com.astdump.cli;

import com.astdump.walk.SerializationOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for a command-line run. Defaults come from {@code astdump.yaml} on the classpath, an
 * optional config file overrides them, and command-line flags override both.
 */
public class AstDumpConfig {
    private boolean pretty = true;
    private int maxDepth = SerializationOptions.DEFAULT_MAX_DEPTH;
    private String languageLevel = "JAVA_17";
    private boolean includeComments = false;
    // empty means the front end's own literal kinds
    private List<String> literalKinds = new ArrayList<>();
    private String output = "output.json";
    private String outputDir = "json_out";

    public boolean isPretty() {
        return pretty;
    }

    public void setPretty(boolean pretty) {
        this.pretty = pretty;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public String getLanguageLevel() {
        return languageLevel;
    }

    public void setLanguageLevel(String languageLevel) {
        this.languageLevel = languageLevel;
    }

    public boolean isIncludeComments() {
        return includeComments;
    }

    public void setIncludeComments(boolean includeComments) {
        this.includeComments = includeComments;
    }

    public List<String> getLiteralKinds() {
        return literalKinds;
    }

    public void setLiteralKinds(List<String> literalKinds) {
        this.literalKinds = new ArrayList<>(literalKinds);
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }
}
