package com.rcatrail.repository;

import com.rcatrail.model.EtlWatermark;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EtlWatermarkRepository extends JpaRepository<EtlWatermark, String> {
}
