package app.lexis.core.vocab.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "vocab_words", schema = "app_core")
public class VocabWordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "word_id")
    private Long wordId;

    @Column(name = "word", nullable = false)
    private String word;

    @Column(name = "part_of_speech", nullable = false)
    private String partOfSpeech;

    @Column(name = "meaning", nullable = false)
    private String meaning;

    @Column(name = "translation", nullable = false)
    private String translation;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Long getWordId() {
        return wordId;
    }

    public void setWordId(Long wordId) {
        this.wordId = wordId;
    }

    public String getWord() {
        return word;
    }

    public void setWord(String word) {
        this.word = word;
    }

    public String getPartOfSpeech() {
        return partOfSpeech;
    }

    public void setPartOfSpeech(String partOfSpeech) {
        this.partOfSpeech = partOfSpeech;
    }

    public String getMeaning() {
        return meaning;
    }

    public void setMeaning(String meaning) {
        this.meaning = meaning;
    }

    public String getTranslation() {
        return translation;
    }

    public void setTranslation(String translation) {
        this.translation = translation;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
