package com.ryuqq.workflow.testkit.fixture;

import java.util.List;

/**
 * Result of a single page analysis.
 *
 * <p>Mutated only through the page workflow's DataTracker.</p>
 */
public final class PageData {

    private List<String> visualInformation = List.of();
    private List<String> extractedText = List.of();
    private String parameter1;
    private String parameter2;
    private String parameter3;

    public List<String> getVisualInformation() {
        return visualInformation;
    }

    public void setVisualInformation(List<String> visualInformation) {
        this.visualInformation = List.copyOf(visualInformation);
    }

    public List<String> getExtractedText() {
        return extractedText;
    }

    public void setExtractedText(List<String> extractedText) {
        this.extractedText = List.copyOf(extractedText);
    }

    public String getParameter1() {
        return parameter1;
    }

    public void setParameter1(String parameter1) {
        this.parameter1 = parameter1;
    }

    public String getParameter2() {
        return parameter2;
    }

    public void setParameter2(String parameter2) {
        this.parameter2 = parameter2;
    }

    public String getParameter3() {
        return parameter3;
    }

    public void setParameter3(String parameter3) {
        this.parameter3 = parameter3;
    }

    @Override
    public String toString() {
        return "PageData{visual=" + visualInformation + ", text=" + extractedText
            + ", p1=" + parameter1 + ", p2=" + parameter2 + ", p3=" + parameter3 + "}";
    }
}
