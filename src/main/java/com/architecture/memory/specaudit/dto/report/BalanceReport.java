package com.architecture.memory.specaudit.dto.report;

import com.architecture.memory.specaudit.dto.finding.BalanceIssue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceReport {

    @Builder.Default
    private List<LayerBalance> layers = new ArrayList<>();

    @Builder.Default
    private List<BalanceIssue> issues = new ArrayList<>();
}
