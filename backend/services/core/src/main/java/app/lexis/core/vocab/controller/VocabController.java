package app.lexis.core.vocab.controller;

import app.lexis.core.vocab.domain.dto.ClearWordsResponse;
import app.lexis.core.vocab.domain.dto.VocabWordDTO;
import app.lexis.core.vocab.domain.request.CreateWordRequest;
import app.lexis.core.vocab.service.VocabService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/words")
public class VocabController {

    private final VocabService vocabService;

    public VocabController(VocabService vocabService) {
        this.vocabService = vocabService;
    }

    // POST /words
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public VocabWordDTO addWord(@Valid @RequestBody CreateWordRequest request) {
        return vocabService.addWord(request);
    }

    // GET /words
    @GetMapping
    public List<VocabWordDTO> listWords() {
        return vocabService.listWords();
    }

    // DELETE /words
    @DeleteMapping
    public ClearWordsResponse clearAll() {
        return vocabService.clearAll();
    }
}
