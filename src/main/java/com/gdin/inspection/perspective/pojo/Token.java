package com.gdin.inspection.perspective.pojo;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@NoArgsConstructor
@SuperBuilder
@Data
public class Token {
    private String word;
    // 在原文中的词序
    private int position;
}
