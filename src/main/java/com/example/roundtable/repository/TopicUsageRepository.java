package com.example.roundtable.repository;

import com.example.roundtable.model.TopicUsageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TopicUsageRepository extends JpaRepository<TopicUsageEntity, Long> {

    Optional<TopicUsageEntity> findByTitleAndCategory(String title, String category);

    List<TopicUsageEntity> findAllByOrderByUsedCountDescCreatedAtDesc();

    // rows: [category, topics used]
    @Query("select t.category, count(t) from TopicUsageEntity t where t.usedCount > 0 group by t.category order by count(t) desc")
    List<Object[]> topCategories(Pageable page);
}
