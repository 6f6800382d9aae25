package com.hometown.happiness.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

@Entity
@Table(name = "cities")
public class City implements Persistable<String> {

    @Id
    @Column(name = "city_id", length = 128)
    private String id;

    @Column(name = "city_name", nullable = false)
    private String cityName;

    @Column(length = 16)
    private String state;

    @Column(length = 64)
    private String country;

    @Column(length = 128)
    private String slug;

    // ids are assigned up front; cleared once the row is stored or loaded
    @Transient
    private boolean fresh = true;

    public City() {}

    public City(String id, String cityName, String state, String country) {
        this.id = id;
        this.cityName = cityName;
        this.state = state == null ? "" : state;
        this.country = country;
        this.slug = id;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCityName() { return cityName; }
    public void setCityName(String cityName) { this.cityName = cityName; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    @Override
    public boolean isNew() { return fresh; }

    @PostLoad
    @PostPersist
    void markStored() { this.fresh = false; }
}
