package com.purchasingpower.issueflow.controller;

import com.purchasingpower.issueflow.repository.WorkflowStateStore;
import com.purchasingpower.issueflow.service.IssueDispatchService;
import com.purchasingpower.issueflow.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Manual trigger and state inspection for a single issue.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/issues/{owner}/{repo}/{number}")
@RequiredArgsConstructor
public class WorkflowController {

    private final IssueDispatchService dispatchService;
    private final WorkflowStateStore stateStore;

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@PathVariable String owner,
                                                   @PathVariable String repo,
                                                   @PathVariable int number) {
        String fullName = owner + "/" + repo;
        log.info("▶️ Manual run requested for {}#{}", fullName, number);
        dispatchService.dispatch(fullName, number);
        return ResponseEntity.accepted().body(Map.of(
                "repo", fullName,
                "issue", number,
                "status", "accepted"));
    }

    @GetMapping("/state")
    public ResponseEntity<WorkflowState> state(@PathVariable String owner,
                                               @PathVariable String repo,
                                               @PathVariable int number) {
        return stateStore.load(owner + "/" + repo, number)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
