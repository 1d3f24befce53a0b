package com.jz.coach.controller;

import com.jz.coach.chat.humanness.store.ExchangeStore;
import com.jz.coach.chat.humanness.store.ScoreStats;
import com.jz.coach.chat.humanness.store.TrainingExport;
import com.jz.coach.chat.humanness.store.TrainingReadiness;
import com.jz.coach.common.Result;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("api/coach/humanness")
@RequiredArgsConstructor
public class HumannessController {

    private final ExchangeStore store;

    @GetMapping("/stats")
    public Result<ScoreStats> stats() {
        return Result.success(store.stats());
    }

    @GetMapping("/readiness")
    public Result<TrainingReadiness> readiness() {
        return Result.success(store.readiness());
    }

    /** 离线训练用：统计 + 全部样本 */
    @GetMapping("/export")
    public Result<TrainingExport> export() {
        return Result.success(store.export());
    }
}
