package com.procureagent.notification.controller;

import com.procureagent.common.model.Decision;
import com.procureagent.notification.sender.SlackWebhookSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final SlackWebhookSender slackSender;

    public NotificationController(SlackWebhookSender slackSender) {
        this.slackSender = slackSender;
    }

    /** Only HIGH and CRITICAL entries are dispatched; the rest are dropped. */
    @PostMapping("/decisions")
    public ResponseEntity<Void> notifyDecisions(@RequestBody List<Decision> decisions) {
        List<Decision> escalated = decisions.stream()
            .filter(d -> d.priority() != null && d.priority().isEscalated())
            .toList();
        log.info("Decision notification received. total={} escalated={}", decisions.size(), escalated.size());
        slackSender.sendDecisions(escalated);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
