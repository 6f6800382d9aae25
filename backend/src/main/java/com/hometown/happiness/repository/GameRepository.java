package com.hometown.happiness.repository;

import com.hometown.happiness.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface GameRepository extends JpaRepository<Game, String> {
    @Query("select g.id from Game g")
    List<String> findAllIds();

    // Stable export order: date, then id
    List<Game> findAllByOrderByDateAscIdAsc();
}
