package com.loanrecon.compliance;

import com.loanrecon.domain.ComplianceResult;
import com.loanrecon.domain.ComplianceRun;

import java.util.List;

public record ComplianceEvaluation(ComplianceRun run, List<ComplianceResult> results) {
}
