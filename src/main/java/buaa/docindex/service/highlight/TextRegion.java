package buaa.docindex.service.highlight;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 页面上与目标文本对应的区域
 *
 * <p>坐标为PDF用户空间。跨行的匹配每行对应一组四边形坐标，
 * 顺序为左上、右上、左下、右下。</p>
 */
@Data
@AllArgsConstructor
public class TextRegion {

    private int pageNumber;

    private String matchedText;

    /** 每8个数为一组四边形 */
    private float[] quadPoints;

    private float left;

    private float bottom;

    private float right;

    private float top;

    public int getLineCount() {
        return quadPoints == null ? 0 : quadPoints.length / 8;
    }
}
