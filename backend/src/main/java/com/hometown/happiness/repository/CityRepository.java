package com.hometown.happiness.repository;

import com.hometown.happiness.model.City;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface CityRepository extends JpaRepository<City, String> {
    @Query("select c.id from City c")
    List<String> findAllIds();

    List<City> findAllByOrderByIdAsc();
}
