package app.lexis.core.vocab.repository;

import app.lexis.core.vocab.domain.entity.VocabWordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface VocabWordRepository extends JpaRepository<VocabWordEntity, Long> {

    boolean existsByWordIgnoreCase(String word);

    List<VocabWordEntity> findAllByOrderByWordAsc();

    List<VocabWordEntity> findByWordIdIn(Collection<Long> wordIds);

    // sr_card_states rows go with their words through the cascading foreign key
    @Modifying(clearAutomatically = true)
    @Query("delete from VocabWordEntity w")
    int deleteAllWords();
}
