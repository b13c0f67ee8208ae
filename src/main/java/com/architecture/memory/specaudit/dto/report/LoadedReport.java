package com.architecture.memory.specaudit.dto.report;

import com.architecture.memory.specaudit.dto.finding.Finding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A report read back from disk. Exactly one of the two shapes is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadedReport {

    private AuditReport relationshipAudit;
    private NodeAuditReport nodeAudit;

    public boolean hasNodeAudit() {
        return nodeAudit != null;
    }

    public List<Finding> findings() {
        return nodeAudit != null ? nodeAudit.allFindings() : relationshipAudit.allFindings();
    }
}
