package org.dxworks.ruleframe.analyzer;

import org.approvaltests.Approvals;
import org.dxworks.ruleframe.Ruleframe;
import org.dxworks.ruleframe.RuleframeConfig;
import org.dxworks.ruleframe.model.RulesFileAnalysis;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.dxworks.ruleframe.TestUtils.APPROVAL_MAPPER;

public class FormRequestAnalyzeApprovalTest {

    @Test
    void analyze_StoreUserRequest() throws IOException {
        verify(Paths.get("src/test/resources/samples/php/StoreUserRequest.php"));
    }

    @Test
    void analyze_UpdateOrderRequest() throws IOException {
        verify(Paths.get("src/test/resources/samples/php/UpdateOrderRequest.php"));
    }

    private static void verify(Path file) throws IOException {
        RulesFileAnalysis analysis = Ruleframe.analyzeFile(file, RuleframeConfig.defaults());
        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(analysis) + "\n");
    }
}
