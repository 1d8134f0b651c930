package org.dxworks.ruleframe.model;

import java.util.ArrayList;
import java.util.List;

public class RulesFileAnalysis {
    public String filePath;
    public String language;
    public List<FormRequestRules> requests = new ArrayList<>();

    public FormRequestRules findRequest(String className) {
        for (FormRequestRules request : requests) {
            if (request.className != null && request.className.equals(className)) {
                return request;
            }
        }
        return null;
    }
}
