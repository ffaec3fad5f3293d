package com.example.docxschema.util.schema.detect;

import com.example.docxschema.util.schema.feature.ContextWindow;
import com.example.docxschema.util.schema.feature.FeatureVector;

/**
 * 结构角色检测器接口
 *
 * 每个检测器负责一种结构角色，输入单元特征向量及其上下文窗口，返回置信度 [0, 1] 和可选的抽取字段：
 * - 0: 完全不像该角色
 * - 1: 强烈确信
 *
 * 检测器之间互不依赖（不读取其他检测器的结果），可以独立增删和测试。
 */
@FunctionalInterface
public interface Detector {

    /**
     * 检测
     *
     * @param features 当前单元的特征向量
     * @param context 前后邻居的特征向量
     * @return 检测结果（角色名为检测器种类名，由 DomainPack 换成域内角色名）
     */
    DetectionResult detect(FeatureVector features, ContextWindow<FeatureVector> context);
}
