package com.orgscope.backend.modules.organization.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.orgscope.backend.global.common.PageResponse;
import com.orgscope.backend.global.error.ConstraintViolations;
import com.orgscope.backend.global.error.ProblemException;
import com.orgscope.backend.global.error.UniquenessConflictException;
import com.orgscope.backend.modules.access.application.AccessGuard;
import com.orgscope.backend.modules.access.domain.AccessAction;
import com.orgscope.backend.modules.access.infrastructure.persistence.AccessSpecifications;
import com.orgscope.backend.modules.hierarchy.domain.ActiveDescendantsException;
import com.orgscope.backend.modules.organization.domain.BusinessGroup;
import com.orgscope.backend.modules.organization.domain.OrgCoordinates;
import com.orgscope.backend.modules.organization.infrastructure.persistence.BusinessGroupRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.CompanyRepository;
import com.orgscope.backend.modules.organization.infrastructure.persistence.OrgSpecifications;
import com.orgscope.backend.modules.organization.presentation.dto.BusinessGroupResponse;
import com.orgscope.backend.modules.organization.presentation.dto.CreateBusinessGroupRequest;
import com.orgscope.backend.modules.organization.presentation.dto.RenameOrgUnitRequest;

@Service
@Transactional
public class BusinessGroupService {

    private static final Logger log = LoggerFactory.getLogger(BusinessGroupService.class);

    static final String CODE_CONSTRAINT = "uq_business_group_code";

    private final BusinessGroupRepository businessGroupRepository;
    private final CompanyRepository companyRepository;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public BusinessGroupService(
            BusinessGroupRepository businessGroupRepository,
            CompanyRepository companyRepository,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.businessGroupRepository = businessGroupRepository;
        this.companyRepository = companyRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public BusinessGroupResponse createBusinessGroup(CreateBusinessGroupRequest request) {
        // a new tenant root sits above every scope, so only unscoped roles pass
        accessGuard.require(AccessAction.CREATE, new OrgCoordinates(null, null, null, null, null));
        String code = request.code().trim();
        if (businessGroupRepository.existsByCode(code)) {
            throw duplicateCode(code);
        }
        BusinessGroup group = new BusinessGroup();
        group.setCode(code);
        group.setName(request.name().trim());
        try {
            group = businessGroupRepository.saveAndFlush(group);
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.isViolationOf(ex, CODE_CONSTRAINT)) {
                throw duplicateCode(code);
            }
            throw ex;
        }
        log.info("Business group {} ({}) created", group.getId(), code);
        return BusinessGroupResponse.from(group);
    }

    @Transactional(readOnly = true)
    public BusinessGroupResponse getBusinessGroup(Long id) {
        BusinessGroup group = load(id);
        accessGuard.require(AccessAction.READ, group.coordinates());
        return BusinessGroupResponse.from(group);
    }

    @Transactional(readOnly = true)
    public PageResponse<BusinessGroupResponse> listBusinessGroups(String keyword, boolean includeInactive,
            Pageable pageable) {
        Specification<BusinessGroup> search = Specification.where(OrgSpecifications.<BusinessGroup>keyword(keyword))
                .and(OrgSpecifications.activeOnly(includeInactive));
        Specification<BusinessGroup> spec = AccessSpecifications.restrict(accessGuard.listFilter(),
                OrgSpecifications.BUSINESS_GROUP_MAPPING, search);
        return PageResponse.from(businessGroupRepository.findAll(spec, pageable), BusinessGroupResponse::from);
    }

    public BusinessGroupResponse renameBusinessGroup(Long id, RenameOrgUnitRequest request) {
        BusinessGroup group = load(id);
        accessGuard.require(AccessAction.UPDATE, group.coordinates());
        group.setName(request.name().trim());
        return BusinessGroupResponse.from(group);
    }

    public BusinessGroupResponse deactivateBusinessGroup(Long id) {
        BusinessGroup group = businessGroupRepository.findByIdForUpdate(id)
                .orElseThrow(() -> notFound(id));
        accessGuard.require(AccessAction.DELETE, group.coordinates());
        if (!group.isActive()) {
            return BusinessGroupResponse.from(group);
        }
        if (companyRepository.existsByBusinessGroupIdAndActiveTrue(id)) {
            throw new ActiveDescendantsException("business_group " + id + " still has active companies");
        }
        group.deactivate(OffsetDateTime.now(clock));
        log.info("Business group {} deactivated", id);
        return BusinessGroupResponse.from(group);
    }

    private BusinessGroup load(Long id) {
        return businessGroupRepository.findById(id).orElseThrow(() -> notFound(id));
    }

    private static ProblemException notFound(Long id) {
        return new ProblemException(HttpStatus.NOT_FOUND, "business_group.not_found", "business_group " + id + " not found");
    }

    private static UniquenessConflictException duplicateCode(String code) {
        return new UniquenessConflictException("business_group.duplicate_code", "Business group code already used: " + code);
    }
}
