package io.github.drompincen.bugtrackr.gateway.controller;

import io.github.drompincen.bugtrackr.protocol.api.Comment;
import io.github.drompincen.bugtrackr.protocol.api.CreateCommentRequest;
import io.github.drompincen.bugtrackr.runtime.comment.CommentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/comments")
public class CommentController {

    private final CommentService commentService;

    public CommentController(CommentService commentService) {
        this.commentService = commentService;
    }

    @PostMapping
    public ResponseEntity<Comment> create(@RequestBody CreateCommentRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(commentService.addComment(req));
    }

    @GetMapping("/bug/{bugId}")
    public List<Comment> forBug(@PathVariable String bugId) {
        return commentService.commentsFor(bugId);
    }
}
