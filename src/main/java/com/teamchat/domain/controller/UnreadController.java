package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.domain.dto.UnreadCounts;
import com.teamchat.domain.service.ReadReceiptService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/unread-counts")
public class UnreadController {

    private final ReadReceiptService readReceiptService;

    @GetMapping
    public Result<UnreadCounts> unreadCounts() {
        return Result.ok(readReceiptService.unreadCounts(AuthContext.requireUserId()));
    }
}
