package com.vibecoding.k8ssanitizer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 리소스 차원(CPU/Memory)별 할당 허용 범위 (100% 기준 상하 퍼센트)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Allocations {
    private int underPerc;   // 사용량이 요청량을 넘는 허용치
    private int overPerc;    // 요청량이 사용량을 넘는 허용치
}
