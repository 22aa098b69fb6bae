package io.github.drompincen.fixflow.runtime.comment;

import io.github.drompincen.fixflow.persistence.document.CommentDocument;
import io.github.drompincen.fixflow.persistence.repository.CommentRepository;
import io.github.drompincen.fixflow.persistence.repository.WorkOrderRepository;
import io.github.drompincen.fixflow.protocol.api.CreateCommentRequest;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository commentRepository;
    private final WorkOrderRepository workOrderRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public CommentService(CommentRepository commentRepository, WorkOrderRepository workOrderRepository,
                          AccessPolicy accessPolicy, Clock clock) {
        this.commentRepository = commentRepository;
        this.workOrderRepository = workOrderRepository;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    public List<CommentDocument> list(String workOrderId, CurrentUser user) {
        accessPolicy.check(user, Operation.COMMENT_LIST);
        return commentRepository.findTop100ByWorkOrderIdOrderByCreatedAtDesc(workOrderId);
    }

    public CommentDocument add(String workOrderId, CreateCommentRequest request, CurrentUser user) {
        accessPolicy.check(user, Operation.COMMENT_CREATE);
        if (!workOrderRepository.existsById(workOrderId)) {
            throw FixFlowException.notFound("Work order not found");
        }

        CommentDocument comment = new CommentDocument();
        comment.setWorkOrderId(workOrderId);
        comment.setUserId(user.id());
        comment.setUserName(user.name());
        comment.setUserRole(user.role());
        comment.setContent(request.content());
        comment.setCreatedAt(clock.instant());
        comment = commentRepository.save(comment);
        log.debug("Comment {} added to work order {}", comment.getId(), workOrderId);
        return comment;
    }
}
