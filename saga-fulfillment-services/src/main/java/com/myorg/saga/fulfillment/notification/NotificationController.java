package com.myorg.saga.fulfillment.notification;

import com.myorg.saga.fulfillment.common.web.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;
    private final NotificationDispatcher dispatcher;

    @PostMapping("/create")
    public ApiResponse<String> create(@RequestBody CreateNotificationRequest request) {
        Notification n = notificationService.create(request);
        return ApiResponse.ok(n.getId(), "Notification created.");
    }

    @GetMapping("/user/{userId}")
    public ApiResponse<List<Notification>> byUser(@PathVariable("userId") String userId,
                                                  @RequestParam(name = "take", defaultValue = "50") int take,
                                                  @RequestParam(name = "skip", defaultValue = "0") int skip) {
        return ApiResponse.ok(notificationService.listByUser(userId, take, skip));
    }

    @PostMapping("/process-queue")
    public ApiResponse<DispatchSummary> processQueue(@RequestParam(name = "take", defaultValue = "10") int take,
                                                     @RequestParam(name = "skip", defaultValue = "0") int skip) {
        int batch = NotificationService.boundedTake(take, skip);
        return ApiResponse.ok(dispatcher.processBatch(batch, skip), "Queue batch processed.");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> disable(@PathVariable("id") String id) {
        notificationService.disable(id);
        return ApiResponse.ok(null, "Notification disabled.");
    }

    @PostMapping("/preferences")
    public ApiResponse<UserPreference> preferences(@RequestBody PreferenceRequest request) {
        return ApiResponse.ok(notificationService.upsertPreferences(request), "Preferences saved.");
    }
}
