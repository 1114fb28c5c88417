package com.marketplace.realtime.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "listings")
public class Listing {

    @Id
    private String id;

    private String userId;

    @Column(nullable = false)
    private String title;

    @Column(length = 32)
    private String status;

    private long viewsCount;

    public Listing(String id, String userId, String title) {
        this.id = id;
        this.userId = userId;
        this.title = title;
        this.status = "active";
    }
}
