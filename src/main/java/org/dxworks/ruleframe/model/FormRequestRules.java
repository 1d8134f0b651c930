package org.dxworks.ruleframe.model;

public class FormRequestRules {
    public String className;
    public String methodName;
    public RuleSetsResult ruleSets;

    public FormRequestRules(String className, String methodName, RuleSetsResult ruleSets) {
        this.className = className;
        this.methodName = methodName;
        this.ruleSets = ruleSets;
    }
}
