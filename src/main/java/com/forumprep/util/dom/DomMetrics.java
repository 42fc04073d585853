package com.forumprep.util.dom;


public final class DomMetrics {

    private final int originalNodeCount;
    private final int finalNodeCount;
    private final int originalSizeChars;
    private final int finalSizeChars;
    private final double reductionPercentage;
    private final int linkedStylesheets;
    private final int rulesCollected;
    private final int rulesSkippedDynamic;
    private final int stylesheetsFailed;
    private final int elementsStyled;
    private final int propertiesInherited;
    private final int elementsPruned;

    public DomMetrics(int originalNodeCount,
                      int finalNodeCount,
                      int originalSizeChars,
                      int finalSizeChars,
                      int linkedStylesheets,
                      int rulesCollected,
                      int rulesSkippedDynamic,
                      int stylesheetsFailed,
                      int elementsStyled,
                      int propertiesInherited,
                      int elementsPruned) {

        this.originalNodeCount = originalNodeCount;
        this.finalNodeCount = finalNodeCount;
        this.originalSizeChars = originalSizeChars;
        this.finalSizeChars = finalSizeChars;
        this.linkedStylesheets = linkedStylesheets;
        this.rulesCollected = rulesCollected;
        this.rulesSkippedDynamic = rulesSkippedDynamic;
        this.stylesheetsFailed = stylesheetsFailed;
        this.elementsStyled = elementsStyled;
        this.propertiesInherited = propertiesInherited;
        this.elementsPruned = elementsPruned;
        this.reductionPercentage =
                originalSizeChars == 0 ? 0 :
                        100.0 * (originalSizeChars - finalSizeChars) / originalSizeChars;
    }

    public int getOriginalNodeCount() { return originalNodeCount; }
    public int getFinalNodeCount() { return finalNodeCount; }
    public int getOriginalSizeChars() { return originalSizeChars; }
    public int getFinalSizeChars() { return finalSizeChars; }
    public double getReductionPercentage() { return reductionPercentage; }
    public int getLinkedStylesheets() { return linkedStylesheets; }
    public int getRulesCollected() { return rulesCollected; }
    public int getRulesSkippedDynamic() { return rulesSkippedDynamic; }
    public int getStylesheetsFailed() { return stylesheetsFailed; }
    public int getElementsStyled() { return elementsStyled; }
    public int getPropertiesInherited() { return propertiesInherited; }
    public int getElementsPruned() { return elementsPruned; }
}
