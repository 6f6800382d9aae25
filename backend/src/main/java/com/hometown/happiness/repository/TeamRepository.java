package com.hometown.happiness.repository;

import com.hometown.happiness.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, String> {
    @Query("select t.id from Team t")
    List<String> findAllIds();

    List<Team> findAllByOrderByIdAsc();
}
