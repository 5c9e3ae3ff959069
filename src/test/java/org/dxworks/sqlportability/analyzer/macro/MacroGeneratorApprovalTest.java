package org.dxworks.sqlportability.analyzer.macro;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.util.List;

public class MacroGeneratorApprovalTest {

    @Test
    void render_SparkDuckdbRedshiftBigquery() {
        Approvals.verify(MacroGenerator.render(
                List.of("spark", "duckdb", "redshift", "bigquery"),
                List.of("COLLECT_LIST", "DATE_TRUNC", "DATE_ADD")));
    }
}
