package buaa.docindex.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PageAnnotation {

    private int pageNumber;

    private String summary;

    /** 最多20个 */
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /** 最多15个 */
    @Builder.Default
    private List<String> relations = new ArrayList<>();
}
