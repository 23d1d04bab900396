package app.lexis.core.review.controller;

import app.lexis.core.review.controller.dto.AnswerCardRequest;
import app.lexis.core.review.controller.dto.PendingCardResponse;
import app.lexis.core.review.controller.dto.ReviewAnswerResponse;
import app.lexis.core.review.controller.dto.ReviewNextCardResponse;
import app.lexis.core.review.controller.dto.ReviewStatsResponse;
import app.lexis.core.review.domain.Rating;
import app.lexis.core.review.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/review")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    // GET /review/pending
    @GetMapping("/pending")
    public List<PendingCardResponse> pending() {
        return reviewService.pending();
    }

    // GET /review/next
    @GetMapping("/next")
    public ReviewNextCardResponse next() {
        return reviewService.nextCard();
    }

    // POST /review/words/{wordId}/answer
    @PostMapping("/words/{wordId}/answer")
    public ReviewAnswerResponse answer(@PathVariable Long wordId,
                                       @Valid @RequestBody AnswerCardRequest req) {
        Rating rating = Rating.fromString(req.rating());
        return reviewService.answer(wordId, rating);
    }

    // GET /review/stats
    @GetMapping("/stats")
    public ReviewStatsResponse stats() {
        return reviewService.stats();
    }
}
